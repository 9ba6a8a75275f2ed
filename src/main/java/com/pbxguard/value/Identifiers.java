package com.pbxguard.value;

import java.util.regex.Pattern;

public final class Identifiers {
    public static final int LENGTH = 24;

    private static final Pattern SHAPE = Pattern.compile("[0-9A-Fa-f]{24}");

    private Identifiers() {}

    public static boolean isWellFormed(String candidate) {
        return candidate != null && SHAPE.matcher(candidate).matches();
    }
}
