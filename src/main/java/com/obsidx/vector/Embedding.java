package com.obsidx.vector;

/**
 * A vector together with the version of the service that actually produced
 * it, which can differ from the configured service when it fell back.
 */
public record Embedding(float[] vector, String version) {
}
