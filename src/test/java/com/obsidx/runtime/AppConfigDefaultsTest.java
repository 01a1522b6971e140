package com.obsidx.runtime;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToLocalIndexAndStandardChunking() {
        AppConfig config = new AppConfig();

        assertEquals("./.obsidx", config.getIndex().getLocation());
        assertTrue(config.getIndex().getRegistryPath().endsWith(".obsidx/collections.json"));
        assertEquals(1500, config.getChunking().getMaxChars());
        assertEquals(200, config.getChunking().getOverlap());
        assertEquals(384, config.getEmbedding().getDimension());
        assertEquals(20, config.getSearch().getDefaultLimit());
        assertEquals(60, config.getSearch().getRrfK());
        assertEquals(500L, config.getWatch().getDebounceMs());
    }

    @Test
    void shouldKeepDefaultsForMissingSectionsAndIgnoreUnknownKeys() throws Exception {
        AppConfig config = new ObjectMapper(new YAMLFactory()).readValue("""
                chunking:
                  maxChars: 800
                search:
                unknown:
                  key: value
                """, AppConfig.class);

        assertEquals(800, config.getChunking().getMaxChars());
        assertEquals(200, config.getChunking().getOverlap());
        assertEquals(20, config.getSearch().getDefaultLimit());
        assertEquals("./.obsidx", config.getIndex().getLocation());
    }
}
