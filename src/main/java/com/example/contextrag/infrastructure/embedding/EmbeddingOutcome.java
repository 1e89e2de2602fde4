package com.example.contextrag.infrastructure.embedding;

/**
 * Result of embedding one text. Workers hand these back instead of throwing, so the
 * dispatcher applies one retry/skip policy to every failure.
 */
public sealed interface EmbeddingOutcome
        permits EmbeddingOutcome.Success, EmbeddingOutcome.TransientFailure, EmbeddingOutcome.PermanentFailure {

    record Success(float[] vector) implements EmbeddingOutcome {
    }

    /** Timeout, rate limit or connection trouble; worth another attempt. */
    record TransientFailure(String reason) implements EmbeddingOutcome {
    }

    /** Rejected input or unusable response; retrying will not help. */
    record PermanentFailure(String reason) implements EmbeddingOutcome {
    }

    static EmbeddingOutcome success(float[] vector) {
        return new Success(vector);
    }

    static EmbeddingOutcome transientFailure(String reason) {
        return new TransientFailure(reason);
    }

    static EmbeddingOutcome permanentFailure(String reason) {
        return new PermanentFailure(reason);
    }
}
