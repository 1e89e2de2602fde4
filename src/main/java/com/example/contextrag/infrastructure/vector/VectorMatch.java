package com.example.contextrag.infrastructure.vector;

import java.util.Map;

public record VectorMatch(String chunkId, String content, Map<String, Object> metadata, double score) {

    public VectorMatch {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
