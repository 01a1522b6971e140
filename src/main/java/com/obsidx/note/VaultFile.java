package com.obsidx.note;

import java.nio.file.Path;

/**
 * A note file as read from disk: absolute location, vault-relative key,
 * raw text and modification time in epoch milliseconds.
 */
public record VaultFile(Path absolutePath, String relativePath, String rawText, long mtime) {
}
