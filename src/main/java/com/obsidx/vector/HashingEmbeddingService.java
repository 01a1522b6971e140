package com.obsidx.vector;

/**
 * Deterministic placeholder for a learned model. Each character is hashed
 * together with its position into a bucket; the bucket counts are then
 * L2-normalized. Captures no semantics.
 */
public class HashingEmbeddingService implements EmbeddingService {
    private static final String VERSION = "char-position-hash-v1";
    private final int dimension;

    public HashingEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isEmpty()) {
            return vector;
        }

        for (int i = 0; i < text.length(); i++) {
            long h = mix(((long) text.charAt(i) << 32) ^ i);
            int index = (int) Math.floorMod(h, (long) dimension);
            vector[index] += 1f;
        }

        float norm = 0f;
        for (float v : vector) {
            norm += v * v;
        }
        norm = (float) Math.sqrt(norm);
        if (norm > 0f) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION + "-" + dimension;
    }

    // splitmix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
