package com.example.contextrag.domain.model;

import java.util.List;

/**
 * Reranked chunks for one question, best first.
 */
public record RetrievalResult(String query, List<RetrievedChunk> chunks, int candidateCount) {

    public RetrievalResult {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static RetrievalResult empty(String query) {
        return new RetrievalResult(query, List.of(), 0);
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public int size() {
        return chunks.size();
    }
}
