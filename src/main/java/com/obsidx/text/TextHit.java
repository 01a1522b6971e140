package com.obsidx.text;

public record TextHit(String id, String path, float score) {
}
