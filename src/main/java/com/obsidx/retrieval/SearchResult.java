package com.obsidx.retrieval;

/**
 * One ranked path. {@code snippet} is the best matching chunk for semantic
 * and hybrid searches and empty for purely lexical ones.
 */
public record SearchResult(String path, double score, String snippet) {
}
