package com.pbxguard;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.pbxguard.editor.EditResult;
import com.pbxguard.editor.IdGenerator;
import com.pbxguard.editor.ProjectEditor;
import com.pbxguard.editor.ScrubbedReference;
import com.pbxguard.integrity.IntegrityReport;
import com.pbxguard.models.LintConfig;
import com.pbxguard.parser.ProjectParseException;
import com.pbxguard.serializer.CanonicalSerializer;
import com.pbxguard.value.Document;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Automatic repairs: duplicate identifiers first, then dangling references.
 * Works on a copy; the caller decides whether to save or just show the diff.
 */
public class FsckService {

    private final LintConfig config;
    private final IdGenerator idGenerator;
    private final CanonicalSerializer serializer = new CanonicalSerializer();

    public FsckService(LintConfig config) {
        this(config, new IdGenerator());
    }

    public FsckService(LintConfig config, IdGenerator idGenerator) {
        this.config = config != null ? config : LintConfig.defaults();
        this.idGenerator = idGenerator;
    }

    public FsckOutcome repair(Document original) throws ProjectParseException {
        Document working = original.deepCopy();
        ProjectEditor editor = new ProjectEditor(working, config, idGenerator);
        IntegrityReport before = editor.getReport();
        List<String> repairs = new ArrayList<>();
        List<ScrubbedReference> scrubbed = new ArrayList<>();

        EditResult<List<String>> dedup = editor.deduplicateIdentifiers();
        if (dedup.isSuccess()) {
            repairs.addAll(dedup.getValue());
        } else {
            log("Duplicate-id repair rejected: " + dedup.getError());
        }

        EditResult<List<ScrubbedReference>> scrub = editor.scrubDanglingReferences();
        if (scrub.isSuccess()) {
            for (ScrubbedReference ref : scrub.getValue()) {
                scrubbed.add(ref);
                repairs.add("Removed dangling reference " + ref);
            }
        } else {
            log("Dangling-reference repair rejected: " + scrub.getError());
        }

        log("fsck applied " + repairs.size() + " repair(s)");
        return new FsckOutcome(before, editor.getReport(), repairs, scrubbed, working);
    }

    /**
     * Unified diff between the text as loaded and the canonical text of {@code document}.
     * Empty when nothing would change.
     */
    public String diff(String fileName, String originalText, Document document) {
        String revisedText = serializer.serialize(document);
        if (revisedText.equals(originalText)) {
            return "";
        }
        List<String> original = Arrays.asList(originalText.split("\n", -1));
        List<String> revised = Arrays.asList(revisedText.split("\n", -1));
        var patch = DiffUtils.diff(original, revised);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
            "a/" + fileName,
            "b/" + fileName,
            original,
            patch,
            3
        );
        return String.join("\n", unified);
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[FsckService] " + message);
        }
    }

    public record FsckOutcome(IntegrityReport before,
                              IntegrityReport after,
                              List<String> repairs,
                              List<ScrubbedReference> scrubbed,
                              Document repaired) {

        public boolean changed() {
            return !repairs.isEmpty();
        }
    }
}
