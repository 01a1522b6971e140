package com.obsidx.vector;

import java.util.Map;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    static final String URL_VARIABLE = "OBSIDX_EMBEDDING_URL";
    static final String PROVIDER_VARIABLE = "OBSIDX_EMBEDDING_PROVIDER";
    static final String API_KEY_VARIABLE = "OBSIDX_EMBEDDING_API_KEY";

    private EmbeddingServices() {
    }

    public static EmbeddingService fromEnvironment(OkHttpClient httpClient, int dimension) {
        return fromEnvironment(httpClient, dimension, System.getenv());
    }

    static EmbeddingService fromEnvironment(OkHttpClient httpClient, int dimension, Map<String, String> environment) {
        EmbeddingService local = new HashingEmbeddingService(dimension);
        String endpoint = environment.get(URL_VARIABLE);
        if (endpoint == null || endpoint.isBlank()) {
            return local;
        }
        String provider = environment.getOrDefault(PROVIDER_VARIABLE, "custom");
        String apiKey = environment.get(API_KEY_VARIABLE);
        return new ExternalProviderEmbeddingService(httpClient, endpoint, provider, apiKey, local);
    }
}
