package com.obsidx.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsidx.text.TextHit;
import com.obsidx.text.TextIndex;
import com.obsidx.vector.SimilarityHit;
import com.obsidx.vector.VectorStore;

public class SearchService {
    private static final Logger log = LoggerFactory.getLogger(SearchService.class);
    // chunks fetched per requested path, so several chunks of one note do not starve the list
    static final int CHUNK_OVERFETCH = 4;
    private static final int SNIPPET_LENGTH = 240;

    private final TextIndex textIndex;
    private final VectorStore vectorStore;
    private final FusionRetriever fusionRetriever;

    public SearchService(TextIndex textIndex, VectorStore vectorStore, FusionRetriever fusionRetriever) {
        this.textIndex = textIndex;
        this.vectorStore = vectorStore;
        this.fusionRetriever = fusionRetriever;
    }

    public List<SearchResult> search(String query, SearchMode mode, int limit, String collectionFilter) {
        if (limit <= 0) {
            return List.of();
        }
        List<SearchResult> results = switch (mode) {
            case lexical -> lexical(query, limit, collectionFilter);
            case semantic -> semantic(query, limit, collectionFilter);
            case hybrid -> hybrid(query, limit, collectionFilter);
        };
        log.debug("search.completed mode={} limit={} collection={} results={}", mode, limit, collectionFilter, results.size());
        return results;
    }

    private List<SearchResult> lexical(String query, int limit, String collectionFilter) {
        List<SearchResult> results = new ArrayList<>();
        for (TextHit hit : textIndex.queryRanked(query, limit, collectionFilter)) {
            results.add(new SearchResult(hit.path(), hit.score(), ""));
        }
        return results;
    }

    private List<SearchResult> semantic(String query, int limit, String collectionFilter) {
        List<SearchResult> results = new ArrayList<>();
        for (SimilarityHit hit : bestChunkPerPath(query, limit, collectionFilter).values()) {
            results.add(new SearchResult(hit.path(), hit.score(), snippet(hit.chunkText())));
        }
        return results;
    }

    private List<SearchResult> hybrid(String query, int limit, String collectionFilter) {
        List<String> lexicalPaths = textIndex.queryRanked(query, limit, collectionFilter).stream()
                .map(TextHit::path)
                .toList();
        Map<String, SimilarityHit> similar = bestChunkPerPath(query, limit, collectionFilter);
        List<String> similarPaths = new ArrayList<>(similar.keySet());

        List<SearchResult> results = new ArrayList<>();
        for (FusedHit fused : fusionRetriever.fuse(List.of(lexicalPaths, similarPaths), limit)) {
            SimilarityHit chunk = similar.get(fused.path());
            results.add(new SearchResult(fused.path(), fused.score(), chunk == null ? "" : snippet(chunk.chunkText())));
        }
        return results;
    }

    /**
     * Similarity ranking reduced to one entry per path (its highest scoring
     * chunk), in rank order, capped at {@code limit} paths.
     */
    private Map<String, SimilarityHit> bestChunkPerPath(String query, int limit, String collectionFilter) {
        Map<String, SimilarityHit> byPath = new LinkedHashMap<>();
        int chunkLimit = (int) Math.min(Integer.MAX_VALUE, (long) limit * CHUNK_OVERFETCH);
        for (SimilarityHit hit : vectorStore.queryBySimilarity(query, chunkLimit, collectionFilter)) {
            byPath.putIfAbsent(hit.path(), hit);
            if (byPath.size() == limit) {
                break;
            }
        }
        return byPath;
    }

    static String snippet(String text) {
        String trimmed = text.strip().replaceAll("\\s+", " ");
        if (trimmed.length() > SNIPPET_LENGTH) {
            trimmed = trimmed.substring(0, SNIPPET_LENGTH) + "...";
        }
        return trimmed;
    }
}
