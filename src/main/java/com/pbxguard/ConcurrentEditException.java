package com.pbxguard;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The file changed on disk between load and save. Reload and retry.
 */
public class ConcurrentEditException extends IOException {
    private final Path path;
    private final String expectedHash;
    private final String actualHash;

    public ConcurrentEditException(Path path, String expectedHash, String actualHash) {
        super(path + " was modified since it was loaded (expected sha256 " + expectedHash
            + ", found " + (actualHash != null ? actualHash : "no file") + ")");
        this.path = path;
        this.expectedHash = expectedHash;
        this.actualHash = actualHash;
    }

    public Path getPath() {
        return path;
    }

    public String getExpectedHash() {
        return expectedHash;
    }

    public String getActualHash() {
        return actualHash;
    }
}
