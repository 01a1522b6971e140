package com.obsidx.vector;

/**
 * Text to fixed-length vector. Implementations are interchangeable; the
 * version string is stored with every vector so a swap forces a re-embed.
 */
public interface EmbeddingService {
    float[] embed(String text);

    int dimension();

    default String version() {
        return "unversioned";
    }

    default Embedding embedVersioned(String text) {
        return new Embedding(embed(text), version());
    }
}
