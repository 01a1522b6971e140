package com.obsidx.vector;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.obsidx.note.Note;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExternalProviderEmbeddingServiceTest {

    @TempDir
    Path tempDir;

    private final HashingEmbeddingService fallback = new HashingEmbeddingService(2);
    private MockWebServer server;
    private ExternalProviderEmbeddingService service;

    @BeforeEach
    void startServer() throws Exception {
        server = new MockWebServer();
        server.start();
        service = new ExternalProviderEmbeddingService(new OkHttpClient(), server.url("/embed").toString(), "acme",
                "secret-key", fallback);
    }

    @AfterEach
    void stopServer() throws Exception {
        server.shutdown();
    }

    @Test
    void shouldPostInputWithBearerTokenAndNormalizeTopLevelEmbedding() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"embedding\":[3,4]}"));

        Embedding embedding = service.embedVersioned("hello");

        assertArrayEquals(new float[] { 0.6f, 0.8f }, embedding.vector(), 1e-6f);
        assertEquals("external-acme-v1", embedding.version());
        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/embed", request.getPath());
        assertEquals("Bearer secret-key", request.getHeader("Authorization"));
        assertEquals("{\"input\":\"hello\"}", request.getBody().readUtf8());
    }

    @Test
    void shouldReadEmbeddingNestedUnderData() {
        server.enqueue(new MockResponse().setBody("{\"data\":[{\"embedding\":[0,-2]}]}"));

        assertArrayEquals(new float[] { 0f, -1f }, service.embed("nested"), 1e-6f);
    }

    @Test
    void shouldOmitAuthorizationWithoutApiKey() throws Exception {
        ExternalProviderEmbeddingService anonymous = new ExternalProviderEmbeddingService(new OkHttpClient(),
                server.url("/embed").toString(), "acme", "", fallback);
        server.enqueue(new MockResponse().setBody("{\"embedding\":[1,0]}"));

        anonymous.embed("text");

        assertNull(server.takeRequest().getHeader("Authorization"));
    }

    @Test
    void shouldFallBackOnWrongDimension() {
        server.enqueue(new MockResponse().setBody("{\"embedding\":[1,2,3]}"));

        Embedding embedding = service.embedVersioned("wrong size");

        assertArrayEquals(fallback.embed("wrong size"), embedding.vector());
        assertEquals(fallback.version(), embedding.version());
    }

    @Test
    void shouldFallBackOnServerErrorAndMissingArray() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"error\":\"down\"}"));
        server.enqueue(new MockResponse().setBody("{\"vectors\":[1,0]}"));
        server.enqueue(new MockResponse().setBody("not json"));

        assertEquals(fallback.version(), service.embedVersioned("a").version());
        assertEquals(fallback.version(), service.embedVersioned("b").version());
        assertArrayEquals(fallback.embed("c"), service.embed("c"));
    }

    @Test
    void shouldStoreFallbackChunksUnderFallbackVersion() {
        server.enqueue(new MockResponse().setResponseCode(503));
        JsonVectorStore store = JsonVectorStore.openOrCreate(tempDir, service);
        Note note = new Note(Note.idFor(Path.of("/vault", "a.md")), "a.md", "default", "a", List.of(), List.of(),
                List.of(), null, "short body", 1L);

        store.upsertNote(note, ChunkParams.DEFAULT, false);

        assertTrue(store.requiresReembedding(service.version()));
        assertFalse(store.requiresReembedding(fallback.version()));
    }
}
