package com.obsidx.note;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One note file's extracted record. Tags and links are kept sorted and
 * deduplicated; headings keep document order.
 */
public record Note(
        String id,
        String path,
        String collection,
        String title,
        List<String> tags,
        List<String> headings,
        List<String> links,
        ObjectNode frontmatter,
        String body,
        long mtime) {

    public Note {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(title, "title");
        tags = normalize(tags);
        links = normalize(links);
        headings = headings == null ? List.of() : List.copyOf(headings);
        frontmatter = frontmatter == null ? JsonNodeFactory.instance.objectNode() : frontmatter;
        body = body == null ? "" : body;
    }

    public static String idFor(Path absolutePath) {
        String key = absolutePath.toAbsolutePath().normalize().toString();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes, 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static List<String> normalize(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                sorted.add(value);
            }
        }
        return List.copyOf(sorted);
    }
}
