package com.example.contextrag.infrastructure.ingest;

import com.example.contextrag.domain.model.CanonicalRecord;
import java.util.List;

/**
 * @param inputCount          records across all input batches
 * @param duplicatesCollapsed records that lost to another revision of the same id
 */
public record MergeResult(List<CanonicalRecord> records, int inputCount, int duplicatesCollapsed) {

    public MergeResult {
        records = List.copyOf(records);
    }
}
