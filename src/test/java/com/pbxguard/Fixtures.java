package com.pbxguard;

import com.pbxguard.parser.Parser;
import com.pbxguard.parser.ProjectParseException;
import com.pbxguard.value.Document;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * The demo project used across tests: one app target with two Swift sources.
 */
public final class Fixtures {

    public static final String PROJECT = "1A0000000000000000000001";
    public static final String MAIN_GROUP = "1A0000000000000000000002";
    public static final String APP_GROUP = "1A0000000000000000000003";
    public static final String PRODUCTS_GROUP = "1A0000000000000000000004";
    public static final String APP_DELEGATE = "1A0000000000000000000005";
    public static final String CONTENT_VIEW = "1A0000000000000000000006";
    public static final String PRODUCT = "1A0000000000000000000007";
    public static final String APP_DELEGATE_BUILD = "1A0000000000000000000008";
    public static final String CONTENT_VIEW_BUILD = "1A0000000000000000000009";
    public static final String SOURCES_PHASE = "1A000000000000000000000A";
    public static final String FRAMEWORKS_PHASE = "1A000000000000000000000B";
    public static final String TARGET = "1A000000000000000000000C";
    public static final String TARGET_CONFIG_LIST = "1A000000000000000000000D";
    public static final String TARGET_DEBUG = "1A000000000000000000000E";
    public static final String TARGET_RELEASE = "1A000000000000000000000F";
    public static final String PROJECT_CONFIG_LIST = "1A0000000000000000000010";
    public static final String PROJECT_DEBUG = "1A0000000000000000000011";
    public static final String PROJECT_RELEASE = "1A0000000000000000000012";

    public static final String MISSING = "FFFFFFFFFFFFFFFFFFFFFFFF";

    private Fixtures() {}

    /** Canonical text of the demo project. */
    public static String demoText() {
        return read("demo.pbxproj");
    }

    /** The same project, hand-edited: shuffled, unsectioned, oddly quoted. */
    public static String messyText() {
        return read("messy.pbxproj");
    }

    public static Document demo() throws ProjectParseException {
        return Parser.parseDocument(demoText());
    }

    public static String read(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
