package com.obsidx.vector;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.obsidx.note.Note;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChunkerTest {

    @Test
    void shouldCoverContentWithFixedStepWindows() {
        String body = "x".repeat(4000);

        List<Chunk> chunks = new Chunker(new ChunkParams(1500, 200)).chunk(note(body));

        assertEquals(3, chunks.size());
        assertEquals(List.of(0, 1300, 2600), chunks.stream().map(Chunk::start).toList());
        assertEquals(List.of(1500, 2800, 4000), chunks.stream().map(Chunk::end).toList());
        assertEquals(List.of(0, 1, 2), chunks.stream().map(Chunk::chunkIndex).toList());
        assertEquals(1400, chunks.get(2).text().length());
    }

    @Test
    void shouldUnionToWholeContentForArbitraryLengths() {
        Chunker chunker = new Chunker(new ChunkParams(7, 3));
        for (int length = 8; length < 40; length++) {
            StringBuilder body = new StringBuilder();
            for (int i = 0; i < length; i++) {
                body.append((char) ('a' + i % 26));
            }

            List<Chunk> chunks = chunker.chunk(note(body.toString()));

            assertEquals(0, chunks.get(0).start());
            assertEquals(length, chunks.get(chunks.size() - 1).end());
            for (int i = 1; i < chunks.size(); i++) {
                assertEquals(4, chunks.get(i).start() - chunks.get(i - 1).start());
                assertEquals(body.substring(chunks.get(i).start(), chunks.get(i).end()), chunks.get(i).text());
            }
        }
    }

    @Test
    void shouldKeepShortContentInOneChunk() {
        List<Chunk> chunks = new Chunker(ChunkParams.DEFAULT).chunk(note("short note"));

        assertEquals(1, chunks.size());
        assertEquals("short note", chunks.get(0).text());
        assertEquals(Chunker.contentHash("short note"), chunks.get(0).contentHash());
        assertEquals(7L, chunks.get(0).mtime());
        assertEquals("n.md", chunks.get(0).path());
    }

    @Test
    void shouldEmitSingleEmptyChunkForEmptyBody() {
        List<Chunk> chunks = new Chunker(ChunkParams.DEFAULT).chunk(note(""));

        assertEquals(1, chunks.size());
        assertEquals(0, chunks.get(0).end());
    }

    @Test
    void shouldRejectOverlapNotSmallerThanWindow() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkParams(100, 100));
        assertThrows(IllegalArgumentException.class, () -> new ChunkParams(100, -1));
        assertThrows(IllegalArgumentException.class, () -> new ChunkParams(0, 0));
    }

    private static Note note(String body) {
        return new Note(Note.idFor(Path.of("/vault/n.md")), "n.md", "default", "n", List.of(), List.of(), List.of(),
                null, body, 7L);
    }
}
