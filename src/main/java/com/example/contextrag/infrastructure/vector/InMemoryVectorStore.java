package com.example.contextrag.infrastructure.vector;

import com.example.contextrag.domain.model.VectorRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded backend over a concurrent map. Queries are an exact scan, which is fine for tests
 * and small corpora.
 */
public class InMemoryVectorStore implements VectorStoreAdapter {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorStore.class);

    public static final String BACKEND = "memory";

    private final ConcurrentMap<String, VectorRecord> records = new ConcurrentHashMap<>();
    private final AtomicInteger dimensions = new AtomicInteger();
    private volatile boolean open;

    @Override
    public void open() {
        open = true;
        log.info("event=vector_store_open backend={}", BACKEND);
    }

    @Override
    public void upsert(VectorRecord record) {
        ensureOpen();
        int dim = record.embedding().length;
        if (!dimensions.compareAndSet(0, dim) && dimensions.get() != dim) {
            throw new VectorRecordRejectedException(record.chunkId(), "dimension mismatch for chunk "
                    + record.chunkId() + ": expected " + dimensions.get() + ", got " + dim);
        }
        records.put(record.chunkId(), record);
    }

    @Override
    public List<VectorMatch> query(float[] vector, int k, MetadataFilter filter) {
        ensureOpen();
        if (k <= 0 || vector == null || vector.length == 0) {
            return List.of();
        }
        MetadataFilter f = filter == null ? MetadataFilter.none() : filter;

        List<VectorMatch> scored = new ArrayList<>();
        for (VectorRecord r : records.values()) {
            if (!f.matches(r.metadata())) {
                continue;
            }
            double score = VectorMath.cosine(vector, r.embedding());
            scored.add(new VectorMatch(r.chunkId(), r.rawText(), r.metadata(), score));
        }
        scored.sort(Comparator.comparingDouble(VectorMatch::score).reversed()
                .thenComparing(VectorMatch::chunkId));
        return scored.size() <= k ? scored : new ArrayList<>(scored.subList(0, k));
    }

    @Override
    public VectorStoreStats stats() {
        ensureOpen();
        Map<String, Long> bySource = new TreeMap<>();
        for (VectorRecord r : records.values()) {
            Object source = r.metadata().get("source");
            bySource.merge(source == null ? "unknown" : String.valueOf(source), 1L, Long::sum);
        }
        return new VectorStoreStats(BACKEND, records.size(), dimensions.get(), bySource);
    }

    @Override
    public void close() {
        open = false;
        log.info("event=vector_store_closed backend={} records={}", BACKEND, records.size());
    }

    private void ensureOpen() {
        if (!open) {
            throw new VectorStoreUnavailableException("in-memory vector store is not open");
        }
    }
}
