package com.example.contextrag.domain.model;

public record Embedding(String chunkId, float[] vector, String model) {

    public int dimensions() {
        return vector == null ? 0 : vector.length;
    }
}
