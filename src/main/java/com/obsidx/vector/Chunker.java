package com.obsidx.vector;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

import com.obsidx.note.Note;

/**
 * Fixed-size character windows over raw length. Windows may cut words or
 * sentences; consecutive starts are exactly {@code maxChars - overlap} apart.
 */
public class Chunker {
    private final ChunkParams params;

    public Chunker(ChunkParams params) {
        this.params = params;
    }

    public List<Chunk> chunk(Note note) {
        String content = note.body();
        List<Chunk> chunks = new ArrayList<>();
        int length = content.length();
        if (length <= params.maxChars()) {
            chunks.add(toChunk(note, 0, 0, length));
            return chunks;
        }

        int start = 0;
        int chunkIndex = 0;
        while (true) {
            int endExclusive = Math.min(length, start + params.maxChars());
            chunks.add(toChunk(note, chunkIndex, start, endExclusive));
            if (endExclusive == length) {
                break;
            }
            start += params.step();
            chunkIndex++;
        }
        return chunks;
    }

    private Chunk toChunk(Note note, int chunkIndex, int start, int endExclusive) {
        String text = note.body().substring(start, endExclusive);
        return new Chunk(note.id(), note.path(), note.collection(), chunkIndex, start, endExclusive, text, contentHash(text), note.mtime());
    }

    static String contentHash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
