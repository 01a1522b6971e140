package com.obsidx.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal Rank Fusion. Only each item's position in each list matters;
 * the rankers' own score scales are ignored.
 */
public class FusionRetriever {
    public static final int DEFAULT_K = 60;

    private final int k;

    public FusionRetriever() {
        this(DEFAULT_K);
    }

    public FusionRetriever(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be >= 0");
        }
        this.k = k;
    }

    /**
     * Item at zero-based rank {@code r} in a list contributes
     * {@code 1 / (k + r + 1)}; contributions are summed across lists. Equal
     * fused scores keep the order in which items were first seen.
     */
    public List<FusedHit> fuse(List<List<String>> rankedLists, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        for (List<String> ranked : rankedLists) {
            for (int rank = 0; rank < ranked.size(); rank++) {
                scores.merge(ranked.get(rank), 1.0 / (k + rank + 1), Double::sum);
            }
        }
        List<FusedHit> fused = new ArrayList<>();
        scores.forEach((path, score) -> fused.add(new FusedHit(path, score)));
        fused.sort(Comparator.comparingDouble(FusedHit::score).reversed());
        return List.copyOf(fused.subList(0, Math.min(limit, fused.size())));
    }

    public int k() {
        return k;
    }
}
