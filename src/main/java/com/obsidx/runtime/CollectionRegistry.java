package com.obsidx.runtime;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

public interface CollectionRegistry {
    Optional<Path> lookup(String name);

    Map<String, Path> entries();

    default CollectionScope resolve(String name, Path vaultArgument) {
        if (name == null || name.isBlank()) {
            if (vaultArgument == null) {
                throw new IllegalArgumentException("--vault is required when no --collection is given");
            }
            return CollectionScope.unscoped(vaultArgument);
        }
        Path root = lookup(name).orElseThrow(() -> new ObsidxException(
                ErrorKind.UNKNOWN_COLLECTION,
                "Unknown collection '" + name + "'. Known collections: " + entries().keySet()));
        return new CollectionScope(name, root);
    }

    static CollectionRegistry empty() {
        return of(Map.of());
    }

    static CollectionRegistry of(Map<String, Path> table) {
        Map<String, Path> copy = Map.copyOf(table);
        return new CollectionRegistry() {
            @Override
            public Optional<Path> lookup(String name) {
                return Optional.ofNullable(copy.get(name));
            }

            @Override
            public Map<String, Path> entries() {
                return copy;
            }
        };
    }
}
