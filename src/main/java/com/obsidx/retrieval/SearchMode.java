package com.obsidx.retrieval;

public enum SearchMode {
    lexical,
    semantic,
    hybrid
}
