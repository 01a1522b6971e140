package com.obsidx.runtime;

import java.nio.file.Path;

/**
 * Root and label under which a vault is indexed. The unnamed scope uses the
 * literal vault argument and the {@value #DEFAULT_COLLECTION} label.
 */
public record CollectionScope(String collection, Path root) {
    public static final String DEFAULT_COLLECTION = "default";

    public static CollectionScope unscoped(Path vault) {
        return new CollectionScope(DEFAULT_COLLECTION, vault);
    }
}
