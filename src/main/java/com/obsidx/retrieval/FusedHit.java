package com.obsidx.retrieval;

public record FusedHit(String path, double score) {
}
