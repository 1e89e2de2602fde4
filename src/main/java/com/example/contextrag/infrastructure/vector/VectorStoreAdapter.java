package com.example.contextrag.infrastructure.vector;

import com.example.contextrag.domain.model.VectorRecord;
import java.util.List;

/**
 * Persistence and similarity search over embedded chunks.
 *
 * <p>A handle is constructed, {@link #open() opened} before first use and {@link #close() closed}
 * at shutdown. Upsert is the only write: keyed by chunk id, last write wins, no duplicates.
 * Implementations must allow concurrent upserts and queries without a store-wide lock.
 */
public interface VectorStoreAdapter extends AutoCloseable {

    /**
     * @throws VectorStoreUnavailableException when the backend cannot be reached
     */
    void open();

    /**
     * @throws VectorRecordRejectedException when the backend refuses the record itself
     * @throws VectorStoreUnavailableException when the backend cannot be reached
     */
    void upsert(VectorRecord record);

    default void upsertAll(List<VectorRecord> records) {
        for (VectorRecord r : records) {
            upsert(r);
        }
    }

    /**
     * Up to {@code k} nearest records by cosine similarity, best first. Returning fewer than
     * {@code k} matches is not an error.
     */
    List<VectorMatch> query(float[] vector, int k, MetadataFilter filter);

    VectorStoreStats stats();

    @Override
    void close();
}
