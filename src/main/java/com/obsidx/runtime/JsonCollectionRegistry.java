package com.obsidx.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Collection table persisted as a JSON object of name to root path. Loaded
 * once and handed to the core as a read-only {@link CollectionRegistry};
 * {@link #save} is only used by the collections command.
 */
public class JsonCollectionRegistry implements CollectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(JsonCollectionRegistry.class);

    private final Path registryPath;
    private final Map<String, Path> table;
    private final ObjectMapper mapper = new ObjectMapper();

    private JsonCollectionRegistry(Path registryPath, Map<String, Path> table) {
        this.registryPath = registryPath;
        this.table = table;
    }

    public static JsonCollectionRegistry load(Path registryPath) throws IOException {
        Map<String, Path> table = new TreeMap<>();
        if (Files.exists(registryPath) && Files.size(registryPath) > 0L) {
            Map<String, String> raw = new ObjectMapper().readValue(registryPath.toFile(),
                    new TypeReference<Map<String, String>>() {
                    });
            raw.forEach((name, root) -> table.put(name, Path.of(root)));
        }
        log.debug("collections.loaded path={} count={}", registryPath, table.size());
        return new JsonCollectionRegistry(registryPath, table);
    }

    @Override
    public Optional<Path> lookup(String name) {
        return Optional.ofNullable(table.get(name));
    }

    @Override
    public Map<String, Path> entries() {
        return Collections.unmodifiableMap(table);
    }

    public void put(String name, Path root) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("collection name must not be blank");
        }
        table.put(name, root.toAbsolutePath().normalize());
    }

    public boolean remove(String name) {
        return table.remove(name) != null;
    }

    public void save() throws IOException {
        if (registryPath.getParent() != null) {
            Files.createDirectories(registryPath.getParent());
        }
        Map<String, String> raw = new LinkedHashMap<>();
        table.forEach((name, root) -> raw.put(name, root.toString()));
        mapper.writerWithDefaultPrettyPrinter().writeValue(registryPath.toFile(), raw);
    }
}
