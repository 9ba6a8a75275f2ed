package com.pbxguard;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pbxguard.models.LintConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Loads the integrity-check policy: an explicit file, else {@code .pbxguard.json}
 * beside the project file, else defaults.
 */
public class LintConfigStore {
    public static final String FILE_NAME = ".pbxguard.json";

    private final ObjectMapper objectMapper;

    public LintConfigStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public LintConfig load(Path projectFile, Path explicitConfig) throws IOException {
        if (explicitConfig != null) {
            if (!Files.exists(explicitConfig)) {
                throw new NoSuchFileException(explicitConfig.toString(), null, "lint config not found");
            }
            return read(explicitConfig);
        }
        Path beside = configPathFor(projectFile);
        if (beside == null || !Files.exists(beside)) {
            return LintConfig.defaults();
        }
        return read(beside);
    }

    /**
     * Where the implicit config lives: next to the {@code .xcodeproj} bundle when
     * the project file sits inside one, else next to the file itself.
     */
    public static Path configPathFor(Path projectFile) {
        Path parent = projectFile.toAbsolutePath().getParent();
        if (parent == null) {
            return null;
        }
        if (parent.getFileName() != null && parent.getFileName().toString().endsWith(".xcodeproj")
            && parent.getParent() != null) {
            return parent.getParent().resolve(FILE_NAME);
        }
        return parent.resolve(FILE_NAME);
    }

    public void save(Path configPath, LintConfig config) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(configPath.toFile(), config);
    }

    private LintConfig read(Path path) throws IOException {
        LintConfig loaded = objectMapper.readValue(path.toFile(), LintConfig.class);
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[LintConfigStore] Loaded lint config from " + path);
        }
        return loaded != null ? loaded : LintConfig.defaults();
    }
}
