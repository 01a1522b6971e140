package com.obsidx.runtime;

public enum ErrorKind {
    STORE_UNAVAILABLE,
    MALFORMED_INDEX,
    INVALID_QUERY,
    UNKNOWN_COLLECTION
}
