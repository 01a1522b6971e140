package com.obsidx.vector;

import java.io.IOException;
import java.util.List;

import com.obsidx.note.Note;

public interface VectorStore {
    /**
     * Re-chunks and re-embeds {@code note} unless, in incremental mode, the
     * stored mtime for its note id is at least as new.
     *
     * @return whether the note's chunks were written
     */
    boolean upsertNote(Note note, ChunkParams params, boolean incremental);

    List<SimilarityHit> queryBySimilarity(String text, int limit, String collectionFilter);

    boolean requiresReembedding(String embeddingVersion);

    void clear();

    int chunkCount();

    void save() throws IOException;
}
