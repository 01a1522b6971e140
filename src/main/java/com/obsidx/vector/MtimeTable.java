package com.obsidx.vector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Note id to mtime side table that gates incremental vector updates. Written
 * sorted by id so the file diffs cleanly between runs.
 */
public class MtimeTable {
    private static final TypeReference<Map<String, Long>> TABLE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper = new ObjectMapper();

    public Map<String, Long> load(Path file) throws IOException {
        Map<String, Long> table = new HashMap<>();
        if (Files.exists(file) && Files.size(file) > 0L) {
            table.putAll(mapper.readValue(file.toFile(), TABLE_TYPE));
        }
        return table;
    }

    public void save(Path file, Map<String, Long> table) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), new TreeMap<>(table));
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }
}
