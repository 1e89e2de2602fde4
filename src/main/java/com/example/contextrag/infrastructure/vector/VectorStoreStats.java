package com.example.contextrag.infrastructure.vector;

import java.util.Map;

public record VectorStoreStats(String backend, long recordCount, int dimensions, Map<String, Long> countsBySource) {

    public VectorStoreStats {
        countsBySource = countsBySource == null ? Map.of() : Map.copyOf(countsBySource);
    }
}
