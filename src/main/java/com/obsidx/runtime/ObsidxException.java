package com.obsidx.runtime;

/**
 * Failure of a single store or query operation. Lookups that find nothing
 * return empty results instead of throwing this.
 */
public class ObsidxException extends RuntimeException {
    private final ErrorKind kind;

    public ObsidxException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ObsidxException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
