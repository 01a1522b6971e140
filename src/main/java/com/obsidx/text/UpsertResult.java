package com.obsidx.text;

public record UpsertResult(int written, int skipped) {
}
