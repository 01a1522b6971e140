package com.obsidx.vector;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.obsidx.note.Note;
import com.obsidx.runtime.ErrorKind;
import com.obsidx.runtime.ObsidxException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonVectorStoreTest {

    @TempDir
    Path tempDir;

    private final EmbeddingService embeddings = new HashingEmbeddingService(64);

    @Test
    void shouldGateIncrementalUpsertsOnMtime() {
        JsonVectorStore store = JsonVectorStore.openOrCreate(tempDir, embeddings);
        ChunkParams params = new ChunkParams(10, 2);

        assertTrue(store.upsertNote(note("x.md", "default", "0123456789abcdef", 100L), params, true));
        int chunksBefore = store.chunkCount();

        assertFalse(store.upsertNote(note("x.md", "default", "changed", 100L), params, true));
        assertFalse(store.upsertNote(note("x.md", "default", "changed", 50L), params, true));
        assertEquals(chunksBefore, store.chunkCount());

        assertTrue(store.upsertNote(note("x.md", "default", "changed", 101L), params, true));
        assertEquals(1, store.chunkCount());
        assertEquals(101L, store.mtimes().get(Note.idFor(Path.of("/vault", "x.md"))));
    }

    @Test
    void shouldPersistAndReloadChunks() throws Exception {
        JsonVectorStore store = JsonVectorStore.openOrCreate(tempDir, embeddings);
        store.upsertNote(note("a.md", "default", "first note text", 1L), ChunkParams.DEFAULT, false);
        store.upsertNote(note("b.md", "default", "second note text", 2L), ChunkParams.DEFAULT, false);
        store.save();

        JsonVectorStore reopened = JsonVectorStore.openOrCreate(tempDir, embeddings);

        assertEquals(2, reopened.chunkCount());
        assertEquals(2L, reopened.mtimes().get(Note.idFor(Path.of("/vault", "b.md"))));
        assertEquals("a.md", reopened.queryBySimilarity("first note text", 1, null).get(0).path());
        assertFalse(reopened.requiresReembedding(embeddings.version()));
        assertTrue(reopened.requiresReembedding(new HashingEmbeddingService(32).version()));
    }

    @Test
    void shouldKeepSameRelativePathFromDifferentRootsApart() {
        JsonVectorStore store = JsonVectorStore.openOrCreate(tempDir, embeddings);
        Note work = new Note(Note.idFor(Path.of("/work", "README.md")), "README.md", "work", "README", List.of(), List.of(),
                List.of(), null, "work readme body", 5L);
        Note home = new Note(Note.idFor(Path.of("/home", "README.md")), "README.md", "home", "README", List.of(), List.of(),
                List.of(), null, "home readme body", 1L);

        assertTrue(store.upsertNote(work, ChunkParams.DEFAULT, true));
        assertTrue(store.upsertNote(home, ChunkParams.DEFAULT, true));

        assertEquals(2, store.chunkCount());
        assertEquals(1, store.queryBySimilarity("home readme body", 5, "home").size());
        assertEquals(1, store.queryBySimilarity("work readme body", 5, "work").size());
    }

    @Test
    void shouldLabelChunksWithVersionThatProducedThem() {
        EmbeddingService labelled = new EmbeddingService() {
            @Override
            public float[] embed(String text) {
                return embeddings.embed(text);
            }

            @Override
            public int dimension() {
                return embeddings.dimension();
            }

            @Override
            public String version() {
                return "remote-v1";
            }

            @Override
            public Embedding embedVersioned(String text) {
                return embeddings.embedVersioned(text);
            }
        };
        JsonVectorStore store = JsonVectorStore.openOrCreate(tempDir, labelled);

        store.upsertNote(note("a.md", "default", "served by the local fallback", 1L), ChunkParams.DEFAULT, false);

        assertTrue(store.requiresReembedding("remote-v1"));
        assertFalse(store.requiresReembedding(embeddings.version()));
    }

    @Test
    void shouldDeduplicateIdenticalChunksWithinNote() {
        JsonVectorStore store = JsonVectorStore.openOrCreate(tempDir, embeddings);

        store.upsertNote(note("r.md", "default", "abcdabcdabcdXYZW", 1L), new ChunkParams(8, 4), false);

        assertEquals(2, store.chunkCount());
    }

    @Test
    void shouldFilterByCollectionAndRankByCosine() {
        JsonVectorStore store = JsonVectorStore.openOrCreate(tempDir, embeddings);
        store.upsertNote(note("w.md", "work", "quarterly budget review", 1L), ChunkParams.DEFAULT, false);
        store.upsertNote(note("h.md", "home", "quarterly budget review", 1L), ChunkParams.DEFAULT, false);
        store.upsertNote(note("z.md", "home", "zzzz", 1L), ChunkParams.DEFAULT, false);

        List<SimilarityHit> home = store.queryBySimilarity("quarterly budget review", 5, "home");

        assertEquals(List.of("h.md", "z.md"), home.stream().map(SimilarityHit::path).toList());
        assertEquals(1.0f, home.get(0).score(), 1e-5f);
        assertEquals(List.of(), store.queryBySimilarity("anything", 0, null));
    }

    @Test
    void shouldKeepStorageOrderForEqualScores() {
        JsonVectorStore store = JsonVectorStore.openOrCreate(tempDir, embeddings);
        store.upsertNote(note("first.md", "default", "same", 1L), ChunkParams.DEFAULT, false);
        store.upsertNote(note("second.md", "default", "same", 1L), ChunkParams.DEFAULT, false);

        List<SimilarityHit> hits = store.queryBySimilarity("same", 2, null);

        assertEquals(List.of("first.md", "second.md"), hits.stream().map(SimilarityHit::path).toList());
    }

    @Test
    void shouldScoreZeroForMismatchedOrZeroVectors() {
        assertEquals(0f, JsonVectorStore.cosine(new float[] { 1f, 0f }, new float[] { 1f }));
        assertEquals(0f, JsonVectorStore.cosine(new float[] { 0f, 0f }, new float[] { 1f, 0f }));
        assertEquals(1f, JsonVectorStore.cosine(new float[] { 3f, 4f }, new float[] { 3f, 4f }), 1e-6f);
    }

    @Test
    void shouldReportMalformedChunkFile() throws Exception {
        Path vectors = Files.createDirectories(tempDir.resolve(JsonVectorStore.DIRECTORY));
        Files.writeString(vectors.resolve(JsonVectorStore.CHUNKS_FILE), "{not json");

        ObsidxException error = assertThrows(ObsidxException.class, () -> JsonVectorStore.openOrCreate(tempDir, embeddings));
        assertEquals(ErrorKind.MALFORMED_INDEX, error.kind());
    }

    @Test
    void shouldForgetEverythingOnClear() {
        JsonVectorStore store = JsonVectorStore.openOrCreate(tempDir, embeddings);
        store.upsertNote(note("a.md", "default", "text", 1L), ChunkParams.DEFAULT, false);

        store.clear();

        assertEquals(0, store.chunkCount());
        assertTrue(store.mtimes().isEmpty());
    }

    private static Note note(String path, String collection, String body, long mtime) {
        return new Note(Note.idFor(Path.of("/vault", path)), path, collection, path, List.of(), List.of(), List.of(),
                null, body, mtime);
    }
}
