package com.obsidx.vector;

public record SimilarityHit(String path, int chunkIndex, String chunkText, float score) {
}
