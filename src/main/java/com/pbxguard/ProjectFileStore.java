package com.pbxguard;

import com.pbxguard.graph.ObjectGraphBuilder;
import com.pbxguard.integrity.IntegrityChecker;
import com.pbxguard.integrity.IntegrityReport;
import com.pbxguard.models.LintConfig;
import com.pbxguard.parser.Parser;
import com.pbxguard.parser.ProjectParseException;
import com.pbxguard.parser.Tokenizer;
import com.pbxguard.serializer.CanonicalSerializer;
import com.pbxguard.value.Document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Reads and writes project files. A save only goes through when the file on
 * disk still has the hash it had at load time.
 */
public class ProjectFileStore {

    private final IntegrityChecker checker;
    private final CanonicalSerializer serializer = new CanonicalSerializer();

    public ProjectFileStore() {
        this(LintConfig.defaults());
    }

    public ProjectFileStore(LintConfig config) {
        this.checker = new IntegrityChecker(config);
    }

    /**
     * Reads and parses a project file. Nothing is written, whatever the outcome.
     */
    public LoadedProject load(Path path) throws IOException, ProjectParseException {
        byte[] bytes = Files.readAllBytes(path);
        String text = Tokenizer.decode(bytes);
        Document document = Parser.parseDocument(text);
        log("Loaded " + path + " (" + bytes.length + " bytes)");
        return new LoadedProject(path, document, sha256(bytes), text);
    }

    /**
     * Writes {@code document} canonically over the loaded file.
     *
     * @throws IntegrityException      if the document has blocking violations and {@code force} is false
     * @throws ConcurrentEditException if the file changed on disk since it was loaded
     */
    public LoadedProject save(LoadedProject loaded, Document document, boolean force) throws IOException {
        IntegrityReport report = check(document);
        if (report.hasBlockingViolations()) {
            if (!force) {
                throw new IntegrityException(report);
            }
            log("Saving " + loaded.path() + " with " + report.blocking().size() + " blocking violation(s) (forced)");
        }

        Path target = loaded.path();
        String onDisk = Files.exists(target) ? sha256(Files.readAllBytes(target)) : null;
        if (!loaded.sha256().equals(onDisk)) {
            throw new ConcurrentEditException(target, loaded.sha256(), onDisk);
        }

        String text = serializer.serialize(document);
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        writeAtomic(target, bytes);
        log("Saved " + target + " (" + bytes.length + " bytes)");
        return new LoadedProject(target, document, sha256(bytes), text);
    }

    /**
     * Atomic write: write to .tmp file, then rename. The temp file never outlives a failure.
     */
    private void writeAtomic(Path target, byte[] bytes) throws IOException {
        Path tmpFile = target.resolveSibling(target.getFileName().toString() + ".tmp");
        try {
            Files.write(tmpFile, bytes);
            try {
                Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmpFile);
        }
    }

    private IntegrityReport check(Document document) throws IOException {
        try {
            return checker.check(new ObjectGraphBuilder().buildLenient(document));
        } catch (ProjectParseException e) {
            throw new IOException("Cannot save: " + e.getMessage(), e);
        }
    }

    public static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[ProjectFileStore] " + message);
        }
    }
}
