package com.obsidx.index;

public record IndexReport(
        String collection,
        boolean incremental,
        int scannedFiles,
        int failedFiles,
        int lexicalWritten,
        int lexicalSkipped,
        int vectorWritten,
        int vectorSkipped,
        int totalChunks) {
}
