package com.obsidx.vector;

/**
 * A character window {@code [start, end)} of a note body.
 */
public record Chunk(
        String noteId,
        String path,
        String collection,
        int chunkIndex,
        int start,
        int end,
        String text,
        String contentHash,
        long mtime) {
}
