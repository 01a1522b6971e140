package com.obsidx.vector;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Embeds text through an HTTP endpoint. The request body is
 * {@code {"input": text}}; the response may carry the vector either as a
 * top-level {@code embedding} array or as {@code data[0].embedding}. Any
 * failure falls back to the local service for that call only.
 */
public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(ExternalProviderEmbeddingService.class);
    private static final MediaType APPLICATION_JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final String endpoint;
    private final String provider;
    private final String apiKey;
    private final EmbeddingService fallback;
    private final ObjectMapper mapper = new ObjectMapper();

    public ExternalProviderEmbeddingService(OkHttpClient httpClient, String endpoint, String provider, String apiKey,
            EmbeddingService fallback) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.provider = provider;
        this.apiKey = apiKey;
        this.fallback = fallback;
    }

    @Override
    public float[] embed(String text) {
        return embedVersioned(text).vector();
    }

    /**
     * Vectors produced by the fallback carry the fallback's version, so a
     * store never files them under this provider's version.
     */
    @Override
    public Embedding embedVersioned(String text) {
        try {
            return new Embedding(normalize(requestVector(text == null ? "" : text)), version());
        } catch (IOException e) {
            log.warn("embedding.provider.fallback provider={} reason={}", provider, e.getMessage());
            return fallback.embedVersioned(text);
        }
    }

    @Override
    public int dimension() {
        return fallback.dimension();
    }

    @Override
    public String version() {
        return "external-" + provider + "-v1";
    }

    private float[] requestVector(String text) throws IOException {
        ObjectNode payload = mapper.createObjectNode().put("input", text);
        Request.Builder request = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(mapper.writeValueAsString(payload), APPLICATION_JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(request.build()).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("HTTP " + response.code() + " from " + endpoint);
            }
            JsonNode vector = locateVector(mapper.readTree(body.string()));
            if (vector.size() != dimension()) {
                throw new IOException("expected " + dimension() + " dimensions, got " + vector.size());
            }
            float[] values = new float[vector.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = (float) vector.get(i).asDouble();
            }
            return values;
        }
    }

    private static JsonNode locateVector(JsonNode root) throws IOException {
        JsonNode direct = root.path("embedding");
        if (direct.isArray()) {
            return direct;
        }
        JsonNode nested = root.path("data").path(0).path("embedding");
        if (nested.isArray()) {
            return nested;
        }
        throw new IOException("response has no embedding array");
    }

    static float[] normalize(float[] vector) {
        double sumOfSquares = 0;
        for (float value : vector) {
            sumOfSquares += value * value;
        }
        if (sumOfSquares == 0) {
            return vector;
        }
        float scale = (float) (1.0 / Math.sqrt(sumOfSquares));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
        return vector;
    }
}
