package com.pbxguard;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pbxguard.editor.EditError;
import com.pbxguard.editor.EditResult;
import com.pbxguard.editor.IdGenerator;
import com.pbxguard.editor.ProjectEditor;
import com.pbxguard.editor.ScrubbedReference;
import com.pbxguard.integrity.IntegrityReport;
import com.pbxguard.integrity.Violation;
import com.pbxguard.models.LintConfig;
import com.pbxguard.models.LintReport;
import com.pbxguard.parser.Parser;
import com.pbxguard.parser.ProjectParseException;
import com.pbxguard.serializer.CanonicalSerializer;
import com.pbxguard.value.DictValue;
import com.pbxguard.value.Value;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point. Every command loads the file, works on the typed
 * graph, and writes back only through {@link ProjectFileStore}.
 */
public class Main {

    public static final int EXIT_OK = 0;
    public static final int EXIT_VIOLATIONS = 1;
    public static final int EXIT_PARSE = 2;
    public static final int EXIT_IO = 3;

    private static final String VERSION = "1.0.0";

    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper objectMapper;
    private AppConfig config;
    private LintConfig lintConfig;
    private ProjectFileStore store;

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        return new Main(out, err).execute(args);
    }

    int execute(String[] args) {
        try {
            config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();
        } catch (UsageException e) {
            err.println("Usage error: " + e.getMessage());
            printUsage(err);
            return EXIT_PARSE;
        }

        try {
            AppLogger.initialize(config.getLogFile(), config.isVerbose(), err);
        } catch (IOException e) {
            err.println("Cannot open log file: " + e.getMessage());
            return EXIT_IO;
        }
        AppLogger logger = AppLogger.get();
        logger.info("pbxguard v" + VERSION + " " + config.getCommand() + " " + config.getArguments());

        try {
            return dispatch();
        } catch (UsageException e) {
            err.println("Usage error: " + e.getMessage());
            return EXIT_PARSE;
        } catch (ProjectParseException e) {
            err.println("Parse error: " + e.getMessage());
            logger.error("Parse error: " + e.getMessage());
            return EXIT_PARSE;
        } catch (ConcurrentEditException e) {
            err.println("Concurrent modification: " + e.getMessage());
            err.println("Reload the file and retry.");
            logger.warn(e.getMessage());
            return EXIT_IO;
        } catch (IntegrityException e) {
            err.println(e.getMessage());
            printViolations(err, e.getReport().blocking());
            return EXIT_VIOLATIONS;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            logger.error("I/O error", e);
            return EXIT_IO;
        } finally {
            AppLogger.shutdown();
        }
    }

    private int dispatch() throws UsageException, ProjectParseException, IOException {
        switch (config.getCommand()) {
            case "lint":
                return lint();
            case "fsck":
                return fsck();
            case "format":
                return format();
            case "add-object":
                return addObject();
            case "remove-object":
                return removeObject();
            case "membership":
                return membership();
            case "add-to-target":
                return addToTarget();
            case "import-file":
                return importFile();
            case "clone-configs":
                return cloneConfigs();
            case "set-build-setting":
                return setBuildSetting();
            case "help":
                printUsage(out);
                return EXIT_OK;
            default:
                throw new UsageException("Unknown command '" + config.getCommand() + "'");
        }
    }

    // -------------------------------------------------------------------------
    // Commands
    // -------------------------------------------------------------------------

    private int lint() throws UsageException, ProjectParseException, IOException {
        LoadedProject loaded = load();
        ProjectEditor editor = editorFor(loaded);
        IntegrityReport report = editor.getReport();
        if (config.isJson()) {
            LintReport lint = LintReport.of(loaded.path().toString(), editor.getGraph().size(), report);
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(lint));
        } else {
            printViolations(out, report.getViolations());
            out.println(report.blocking().size() + " blocking, " + report.warnings().size() + " warning(s)");
        }
        return report.hasBlockingViolations() ? EXIT_VIOLATIONS : EXIT_OK;
    }

    private int fsck() throws UsageException, ProjectParseException, IOException {
        LoadedProject loaded = load();
        FsckService fsck = new FsckService(lintConfig);
        FsckService.FsckOutcome outcome = fsck.repair(loaded.document());

        if (!config.isFix() && !config.isDryRun()) {
            printViolations(out, outcome.before().getViolations());
            if (outcome.changed()) {
                out.println(outcome.repairs().size() + " repair(s) available; run with --fix");
            }
            return outcome.before().hasBlockingViolations() ? EXIT_VIOLATIONS : EXIT_OK;
        }

        for (String repair : outcome.repairs()) {
            out.println(repair);
        }
        IntegrityReport after = outcome.after();
        if (config.isDryRun()) {
            String diff = fsck.diff(loaded.path().getFileName().toString(), loaded.text(), outcome.repaired());
            if (!diff.isEmpty()) {
                out.println(diff);
            }
        } else if (!after.hasBlockingViolations() || config.isForce()) {
            store.save(loaded, outcome.repaired(), config.isForce());
            out.println("Saved " + loaded.path());
        }
        if (after.hasBlockingViolations()) {
            err.println("Unrepaired blocking violations remain:");
            printViolations(err, after.blocking());
            return EXIT_VIOLATIONS;
        }
        return EXIT_OK;
    }

    private int format() throws UsageException, ProjectParseException, IOException {
        LoadedProject loaded = load();
        String canonical = new CanonicalSerializer().serialize(loaded.document());
        if (canonical.equals(loaded.text())) {
            out.println(loaded.path() + " is canonical");
            return EXIT_OK;
        }
        if (config.isCheck()) {
            out.println(loaded.path() + " is not canonical");
            return EXIT_VIOLATIONS;
        }
        store.save(loaded, loaded.document(), config.isForce());
        out.println("Formatted " + loaded.path());
        return EXIT_OK;
    }

    private int addObject() throws UsageException, ProjectParseException, IOException {
        LoadedProject loaded = load();
        String isa = config.argument(1);
        String fieldPath = config.argument(2);
        int dot = fieldPath.lastIndexOf('.');
        if (dot <= 0 || dot == fieldPath.length() - 1) {
            throw new UsageException("Expected <container>.<field> but got '" + fieldPath + "'");
        }
        ProjectEditor editor = editorFor(loaded);
        String containerId = ObjectResolver.resolve(editor.getGraph(), fieldPath.substring(0, dot));
        if (containerId == null) {
            err.println("No object matches " + fieldPath.substring(0, dot));
            return EXIT_VIOLATIONS;
        }
        String field = fieldPath.substring(dot + 1);

        DictValue fields = new DictValue();
        for (Map.Entry<String, String> assignment : config.getAssignments().entrySet()) {
            fields.put(assignment.getKey(), Parser.parseValue(assignment.getValue()));
        }
        String comment = config.getComment();

        EditResult<String> result = editor.batch("add-object " + isa, e -> {
            EditResult<String> added = e.addObject(isa, fields, comment);
            if (!added.isSuccess()) {
                return added;
            }
            EditResult<Void> linked = e.addEdge(containerId, field, added.getValue(), comment);
            return linked.isSuccess() ? added : linked.<String>propagate();
        });
        if (!result.isSuccess()) {
            return rejected(result.getError());
        }
        store.save(loaded, editor.getDocument(), config.isForce());
        out.println(result.getValue());
        return EXIT_OK;
    }

    private int removeObject() throws UsageException, ProjectParseException, IOException {
        LoadedProject loaded = load();
        ProjectEditor editor = editorFor(loaded);
        String reference = config.argument(1);
        String id = ObjectResolver.resolve(editor.getGraph(), reference);
        if (id == null) {
            err.println("No object matches " + reference);
            return EXIT_VIOLATIONS;
        }
        EditResult<List<ScrubbedReference>> result = config.isCascade()
            ? editor.deleteObjectCascading(id)
            : editor.deleteObject(id);
        if (!result.isSuccess()) {
            return rejected(result.getError());
        }
        store.save(loaded, editor.getDocument(), config.isForce());
        out.println("Removed " + id);
        for (ScrubbedReference scrubbed : result.getValue()) {
            out.println("  scrubbed " + scrubbed);
        }
        return EXIT_OK;
    }

    private int membership() throws UsageException, ProjectParseException, IOException {
        LoadedProject loaded = load();
        String fileName = config.argument(1);
        String targetName = config.argument(2);
        ProjectEditor editor = editorFor(loaded);
        TargetMembershipService.Membership membership =
            new TargetMembershipService().check(editor.getGraph(), fileName, targetName, config.getPhase());
        if (!membership.targetFound()) {
            out.println("No target named " + targetName);
            return EXIT_VIOLATIONS;
        }
        if (!membership.isMember()) {
            out.println(fileName + " is NOT in the " + config.getPhase() + " phase of " + targetName);
            return EXIT_VIOLATIONS;
        }
        out.println(fileName + " is in the " + config.getPhase() + " phase of " + targetName
            + " via " + String.join(", ", membership.buildFileIds()));
        return EXIT_OK;
    }

    private int addToTarget() throws UsageException, ProjectParseException, IOException {
        LoadedProject loaded = load();
        String file = config.argument(1);
        String targetName = config.argument(2);
        ProjectEditor editor = editorFor(loaded);
        EditResult<String> result =
            new TargetMembershipService().addToTarget(editor, file, targetName, config.getPhase());
        if (!result.isSuccess()) {
            return rejected(result.getError());
        }
        store.save(loaded, editor.getDocument(), config.isForce());
        out.println("Added " + file + " to " + targetName + " as " + result.getValue());
        return EXIT_OK;
    }

    private int importFile() throws UsageException, ProjectParseException, IOException {
        LoadedProject loaded = load();
        String filePath = config.argument(1);
        String group = config.argument(2);
        String targetName = config.argument(3);
        ProjectEditor editor = editorFor(loaded);
        EditResult<TargetMembershipService.ImportedFile> result =
            new TargetMembershipService().importFile(editor, filePath, group, targetName, config.getPhase());
        if (!result.isSuccess()) {
            return rejected(result.getError());
        }
        store.save(loaded, editor.getDocument(), config.isForce());
        out.println("Imported " + filePath + " as " + result.getValue().fileId()
            + " (built by " + result.getValue().buildFileId() + ")");
        return EXIT_OK;
    }

    private int cloneConfigs() throws UsageException, ProjectParseException, IOException {
        LoadedProject loaded = load();
        String targetName = config.argument(1);
        ProjectEditor editor = editorFor(loaded);
        EditResult<Map<String, String>> result =
            new BuildSettingsService().cloneConfigurations(editor, targetName, config.getDropSettings());
        if (!result.isSuccess()) {
            return rejected(result.getError());
        }
        store.save(loaded, editor.getDocument(), config.isForce());
        for (Map.Entry<String, String> clone : result.getValue().entrySet()) {
            out.println("Cloned " + clone.getKey() + " -> " + clone.getValue());
        }
        return EXIT_OK;
    }

    private int setBuildSetting() throws UsageException, ProjectParseException, IOException {
        LoadedProject loaded = load();
        String targetName = config.argument(1);
        String key = config.argument(2);
        ProjectEditor editor = editorFor(loaded);
        BuildSettingsService settings = new BuildSettingsService();
        EditResult<List<String>> result;
        if (config.isUnset()) {
            result = settings.unset(editor, targetName, config.getConfiguration(), key);
        } else {
            Value value = BuildSettingsService.parseSettingValue(config.argument(3));
            result = settings.set(editor, targetName, config.getConfiguration(), key, value);
        }
        if (!result.isSuccess()) {
            return rejected(result.getError());
        }
        if (result.getValue().isEmpty()) {
            out.println("No change");
            return EXIT_OK;
        }
        store.save(loaded, editor.getDocument(), config.isForce());
        out.println("Updated " + key + " in " + result.getValue().size() + " configuration(s)");
        return EXIT_OK;
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private LoadedProject load() throws UsageException, ProjectParseException, IOException {
        Path path = config.getProjectPath();
        lintConfig = new LintConfigStore(objectMapper).load(path, config.getLintConfigPath());
        store = new ProjectFileStore(lintConfig);
        return store.load(path);
    }

    private ProjectEditor editorFor(LoadedProject loaded) throws ProjectParseException {
        return new ProjectEditor(loaded.document(), lintConfig, new IdGenerator());
    }

    private int rejected(EditError error) {
        err.println("Edit rejected: " + error.getKind() + ": " + error.getMessage());
        printViolations(err, error.getViolations());
        AppLogger.get().warn("Edit rejected: " + error);
        return EXIT_VIOLATIONS;
    }

    private static void printViolations(PrintStream stream, List<Violation> violations) {
        for (Violation violation : violations) {
            stream.println((violation.isBlocking() ? "error: " : "warning: ") + violation.getMessage());
        }
    }

    private static void printUsage(PrintStream stream) {
        stream.println("pbxguard v" + VERSION);
        stream.println("Usage:");
        stream.println("  lint <path> [--json]");
        stream.println("  fsck <path> [--fix] [--dry-run] [--force]");
        stream.println("  format <path> [--check] [--force]");
        stream.println("  add-object <path> <isa> <container>.<field> [--set key=value]... [--comment text]");
        stream.println("  remove-object <path> <id-or-name> [--cascade]");
        stream.println("  membership <path> <file> <target> [--phase Sources]");
        stream.println("  add-to-target <path> <file-id-or-name> <target> [--phase Sources]");
        stream.println("  import-file <path> <file-path> <group> <target> [--phase Sources]");
        stream.println("  clone-configs <path> <target> [--drop KEY]...");
        stream.println("  set-build-setting <path> <target> <key> [<value>] [--configuration name] [--unset]");
        stream.println("Common options: --lint-config <file> --verbose --log-file <file>");
    }
}
