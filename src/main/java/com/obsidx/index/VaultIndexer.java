package com.obsidx.index;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsidx.note.Note;
import com.obsidx.note.NoteExtractor;
import com.obsidx.note.VaultFile;
import com.obsidx.note.VaultScanner;
import com.obsidx.runtime.CollectionScope;
import com.obsidx.text.LuceneTextIndex;
import com.obsidx.text.TextIndex;
import com.obsidx.text.UpsertResult;
import com.obsidx.vector.ChunkParams;
import com.obsidx.vector.EmbeddingService;
import com.obsidx.vector.JsonVectorStore;

/**
 * Scan, extract and upsert into both stores. Each call opens and closes its
 * own store handles. Incremental runs only add or replace notes; files that
 * disappeared from the vault stay indexed until the next full run.
 */
public class VaultIndexer {
    private static final Logger log = LoggerFactory.getLogger(VaultIndexer.class);

    private final VaultScanner scanner;
    private final NoteExtractor extractor;
    private final EmbeddingService embeddingService;
    private final ChunkParams chunkParams;

    public VaultIndexer(EmbeddingService embeddingService, ChunkParams chunkParams) {
        this(new VaultScanner(), new NoteExtractor(), embeddingService, chunkParams);
    }

    VaultIndexer(VaultScanner scanner, NoteExtractor extractor, EmbeddingService embeddingService, ChunkParams chunkParams) {
        this.scanner = scanner;
        this.extractor = extractor;
        this.embeddingService = embeddingService;
        this.chunkParams = chunkParams;
    }

    public IndexReport index(CollectionScope scope, Path indexLocation, boolean incremental) throws IOException {
        VaultScanner.ScanResult scan = scanner.scan(scope.root(), indexLocation);
        int failed = scan.failed().size();

        List<Note> notes = new ArrayList<>();
        for (VaultFile file : scan.files()) {
            try {
                notes.add(extractor.extract(file, scope.collection()));
            } catch (RuntimeException e) {
                failed++;
                log.warn("index.extract.failed path={} reason={}", file.relativePath(), e.toString());
            }
        }

        try (TextIndex textIndex = LuceneTextIndex.openOrCreate(indexLocation)) {
            JsonVectorStore vectorStore = JsonVectorStore.openOrCreate(indexLocation, embeddingService);
            boolean vectorIncremental = incremental;
            if (!incremental) {
                vectorStore.clear();
            } else if (vectorStore.requiresReembedding(embeddingService.version())) {
                log.info("index.reembed reason=embedding-version-changed version={}", embeddingService.version());
                vectorStore.clear();
                vectorIncremental = false;
            }

            UpsertResult lexical = textIndex.upsertBatch(notes, incremental);
            int vectorWritten = 0;
            int vectorSkipped = 0;
            for (Note note : notes) {
                if (vectorStore.upsertNote(note, chunkParams, vectorIncremental)) {
                    vectorWritten++;
                } else {
                    vectorSkipped++;
                }
            }
            vectorStore.save();

            IndexReport report = new IndexReport(
                    scope.collection(),
                    incremental,
                    scan.files().size(),
                    failed,
                    lexical.written(),
                    lexical.skipped(),
                    vectorWritten,
                    vectorSkipped,
                    vectorStore.chunkCount());
            log.info("index.completed collection={} incremental={} scanned={} failed={} lexicalWritten={} vectorWritten={} chunks={}",
                    report.collection(),
                    report.incremental(),
                    report.scannedFiles(),
                    report.failedFiles(),
                    report.lexicalWritten(),
                    report.vectorWritten(),
                    report.totalChunks());
            return report;
        }
    }
}
