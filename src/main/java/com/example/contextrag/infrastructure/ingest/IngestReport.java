package com.example.contextrag.infrastructure.ingest;

import lombok.Builder;

/**
 * Outcome of one ingestion run. {@code ABORTED} runs carry the reason in {@code message}; their
 * counters show how far the run got. {@code rejected} counts embedded chunks the store refused.
 */
@Builder(toBuilder = true)
public record IngestReport(
        Status status,
        String message,
        int sources,
        long linesRead,
        int unparseable,
        int malformed,
        int duplicatesCollapsed,
        int records,
        int chunks,
        int embedded,
        int failed,
        int upserted,
        int rejected,
        String embeddingModel,
        long durationMs
) {
    public enum Status {
        OK,
        ABORTED
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
