package com.obsidx.vector;

public record ChunkParams(int maxChars, int overlap) {
    public static final ChunkParams DEFAULT = new ChunkParams(1500, 200);

    public ChunkParams {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be > 0");
        }
        if (overlap < 0 || overlap >= maxChars) {
            throw new IllegalArgumentException("overlap must be >= 0 and < maxChars (got overlap="
                    + overlap + ", maxChars=" + maxChars + ")");
        }
    }

    public int step() {
        return maxChars - overlap;
    }
}
