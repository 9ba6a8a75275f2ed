package com.pbxguard;

import com.pbxguard.value.Document;

import java.nio.file.Path;

/**
 * A project file as it was read: the parsed tree, the exact text, and the
 * SHA-256 of the bytes, which a later save compares against the disk.
 */
public record LoadedProject(Path path, Document document, String sha256, String text) {}
