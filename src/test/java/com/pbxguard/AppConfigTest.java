package com.pbxguard;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    private AppConfig parse(String... args) throws UsageException {
        return new AppConfig.Builder().parseArgs(args).build();
    }

    @Test
    void commandAndPositionals() throws Exception {
        AppConfig config = parse("membership", "p.pbxproj", "AppDelegate.swift", "Demo");
        assertEquals("membership", config.getCommand());
        assertEquals(List.of("p.pbxproj", "AppDelegate.swift", "Demo"), config.getArguments());
        assertEquals(Paths.get("p.pbxproj"), config.getProjectPath());
        assertEquals(AppConfig.DEFAULT_PHASE, config.getPhase());
    }

    @Test
    void flagsAndOptionsInBothSpellings() throws Exception {
        AppConfig config = parse("fsck", "--fix", "p.pbxproj", "--dry-run", "--phase=Frameworks",
            "--configuration", "Debug", "--log-file", "out.log", "--verbose");
        assertTrue(config.isFix());
        assertTrue(config.isDryRun());
        assertTrue(config.isVerbose());
        assertFalse(config.isForce());
        assertEquals("Frameworks", config.getPhase());
        assertEquals("Debug", config.getConfiguration());
        assertEquals(Paths.get("out.log"), config.getLogFile());
    }

    @Test
    void setAssignmentsKeepOrder() throws Exception {
        AppConfig config = parse("add-object", "p", "PBXGroup", "Main.children",
            "--set", "name=Extra", "--set=path=a=b");
        assertEquals(Map.of("name", "Extra", "path", "a=b"), config.getAssignments());
        assertEquals(List.of("name", "path"), List.copyOf(config.getAssignments().keySet()));
    }

    @Test
    void dropOptionsAccumulate() throws Exception {
        AppConfig config = parse("clone-configs", "p", "Demo", "--drop", "TEST_HOST", "--drop=BUNDLE_LOADER");
        assertEquals(List.of("TEST_HOST", "BUNDLE_LOADER"), List.copyOf(config.getDropSettings()));
        assertTrue(parse("lint", "p").getDropSettings().isEmpty());
    }

    @Test
    void doubleDashEndsOptions() throws Exception {
        AppConfig config = parse("remove-object", "p", "--", "--weird-name");
        assertEquals("--weird-name", config.argument(1));
    }

    @Test
    void badInputIsAUsageError() {
        assertThrows(UsageException.class, () -> parse());
        assertThrows(UsageException.class, () -> parse("lint", "--bogus"));
        assertThrows(UsageException.class, () -> parse("lint", "--json=yes"));
        assertThrows(UsageException.class, () -> parse("lint", "--phase"));
        assertThrows(UsageException.class, () -> parse("add-object", "--set", "novalue"));
        assertThrows(UsageException.class, () -> parse("lint").argument(0));
    }
}
