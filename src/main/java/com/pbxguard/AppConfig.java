package com.pbxguard;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command-line configuration for one invocation.
 */
public class AppConfig {

    public static final String DEFAULT_PHASE = "Sources";

    private static final Set<String> VALUE_OPTIONS =
        Set.of("log-file", "lint-config", "set", "comment", "phase", "configuration", "drop");

    private final String command;
    private final List<String> arguments;
    private final boolean json;
    private final boolean fix;
    private final boolean dryRun;
    private final boolean force;
    private final boolean cascade;
    private final boolean check;
    private final boolean unset;
    private final boolean verbose;
    private final Path logFile;
    private final Path lintConfigPath;
    private final Map<String, String> assignments;
    private final String comment;
    private final String phase;
    private final String configuration;
    private final Set<String> dropSettings;

    private AppConfig(Builder b) {
        this.command = b.command;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(b.arguments));
        this.json = b.json;
        this.fix = b.fix;
        this.dryRun = b.dryRun;
        this.force = b.force;
        this.cascade = b.cascade;
        this.check = b.check;
        this.unset = b.unset;
        this.verbose = b.verbose;
        this.logFile = b.logFile;
        this.lintConfigPath = b.lintConfigPath;
        this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(b.assignments));
        this.comment = b.comment;
        this.phase = b.phase;
        this.configuration = b.configuration;
        this.dropSettings = Collections.unmodifiableSet(new LinkedHashSet<>(b.dropSettings));
    }

    public String getCommand() {
        return command;
    }

    /**
     * Positional arguments after the command name.
     */
    public List<String> getArguments() {
        return arguments;
    }

    public String argument(int index) throws UsageException {
        if (index >= arguments.size()) {
            throw new UsageException("Missing argument " + (index + 1) + " for '" + command + "'");
        }
        return arguments.get(index);
    }

    public Path getProjectPath() throws UsageException {
        return Paths.get(argument(0));
    }

    public boolean isJson() {
        return json;
    }

    public boolean isFix() {
        return fix;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isForce() {
        return force;
    }

    public boolean isCascade() {
        return cascade;
    }

    public boolean isCheck() {
        return check;
    }

    public boolean isUnset() {
        return unset;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public Path getLogFile() {
        return logFile;
    }

    public Path getLintConfigPath() {
        return lintConfigPath;
    }

    /**
     * {@code --set key=value} pairs in the order given.
     */
    public Map<String, String> getAssignments() {
        return assignments;
    }

    public String getComment() {
        return comment;
    }

    public String getPhase() {
        return phase;
    }

    public String getConfiguration() {
        return configuration;
    }

    /**
     * Build setting keys given with {@code --drop}.
     */
    public Set<String> getDropSettings() {
        return dropSettings;
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private String command;
        private final List<String> arguments = new ArrayList<>();
        private boolean json;
        private boolean fix;
        private boolean dryRun;
        private boolean force;
        private boolean cascade;
        private boolean check;
        private boolean unset;
        private boolean verbose;
        private Path logFile;
        private Path lintConfigPath;
        private final Map<String, String> assignments = new LinkedHashMap<>();
        private String comment;
        private String phase = DEFAULT_PHASE;
        private String configuration;
        private final Set<String> dropSettings = new LinkedHashSet<>();

        public Builder parseArgs(String[] args) throws UsageException {
            boolean optionsDone = false;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (optionsDone || !arg.startsWith("--")) {
                    positional(arg);
                    continue;
                }
                if ("--".equals(arg)) {
                    optionsDone = true;
                    continue;
                }

                // Handle --name=value or --name value
                String name = arg.substring(2);
                String value = null;
                int eq = name.indexOf('=');
                if (eq >= 0) {
                    value = name.substring(eq + 1);
                    name = name.substring(0, eq);
                }
                if (VALUE_OPTIONS.contains(name)) {
                    if (value == null) {
                        if (i + 1 >= args.length) {
                            throw new UsageException("Option --" + name + " needs a value");
                        }
                        value = args[++i];
                    }
                    option(name, value);
                } else {
                    if (value != null) {
                        throw new UsageException("Option --" + name + " does not take a value");
                    }
                    flag(name);
                }
            }
            return this;
        }

        private void positional(String arg) {
            if (command == null) {
                command = arg;
            } else {
                arguments.add(arg);
            }
        }

        private void option(String name, String value) throws UsageException {
            switch (name) {
                case "log-file":
                    logFile = Paths.get(value);
                    break;
                case "lint-config":
                    lintConfigPath = Paths.get(value);
                    break;
                case "set":
                    int eq = value.indexOf('=');
                    if (eq <= 0) {
                        throw new UsageException("--set expects key=value but got '" + value + "'");
                    }
                    assignments.put(value.substring(0, eq).trim(), value.substring(eq + 1));
                    break;
                case "comment":
                    comment = value;
                    break;
                case "phase":
                    phase = value;
                    break;
                case "configuration":
                    configuration = value;
                    break;
                case "drop":
                    dropSettings.add(value);
                    break;
                default:
                    throw new UsageException("Unknown option --" + name);
            }
        }

        private void flag(String name) throws UsageException {
            switch (name) {
                case "json":
                    json = true;
                    break;
                case "fix":
                    fix = true;
                    break;
                case "dry-run":
                    dryRun = true;
                    break;
                case "force":
                    force = true;
                    break;
                case "cascade":
                    cascade = true;
                    break;
                case "check":
                    check = true;
                    break;
                case "unset":
                    unset = true;
                    break;
                case "verbose":
                    verbose = true;
                    break;
                default:
                    throw new UsageException("Unknown option --" + name);
            }
        }

        public AppConfig build() throws UsageException {
            if (command == null) {
                throw new UsageException("No command given");
            }
            return new AppConfig(this);
        }
    }
}
