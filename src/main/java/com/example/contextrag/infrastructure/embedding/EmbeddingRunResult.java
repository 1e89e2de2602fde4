package com.example.contextrag.infrastructure.embedding;

import com.example.contextrag.domain.model.Embedding;
import java.util.Map;

/**
 * Outcome of one dispatch run.
 *
 * @param embeddings successful embeddings keyed by chunk id
 * @param failures   permanently failed chunk ids with the last failure reason
 * @param requested  distinct chunk ids dispatched
 */
public record EmbeddingRunResult(
        Map<String, Embedding> embeddings,
        Map<String, String> failures,
        int requested,
        long elapsedMs
) {
    public EmbeddingRunResult {
        embeddings = Map.copyOf(embeddings);
        failures = Map.copyOf(failures);
    }

    public int failedCount() {
        return failures.size();
    }

    public int embeddedCount() {
        return embeddings.size();
    }
}
