package com.example.contextrag.infrastructure.ingest;

import com.example.contextrag.domain.model.CanonicalRecord;
import com.example.contextrag.domain.model.Chunk;
import com.example.contextrag.domain.model.Embedding;
import com.example.contextrag.domain.model.RawItem;
import com.example.contextrag.domain.model.VectorRecord;
import com.example.contextrag.infrastructure.embedding.EmbeddingDispatcher;
import com.example.contextrag.infrastructure.embedding.EmbeddingRunResult;
import com.example.contextrag.infrastructure.vector.VectorRecordRejectedException;
import com.example.contextrag.infrastructure.vector.VectorStoreAdapter;
import com.example.contextrag.infrastructure.vector.VectorStoreUnavailableException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Ingestion pipeline, one synchronous run per call:
 * JSON lines -> normalize -> merge -> chunk -> embed -> upsert.
 */
@Service
public class IngestService {

    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    public static final String EMBEDDING_MODEL_KEY = "embedding_model";

    private static final int MAX_LOGGED_MALFORMED = 10;

    private final JsonLinesReader reader;
    private final RecordNormalizer normalizer;
    private final RecordMerger merger;
    private final ContextAwareChunker chunker;
    private final EmbeddingDispatcher embeddingDispatcher;
    private final VectorStoreAdapter vectorStore;
    private final int upsertBatchSize;

    public IngestService(
            JsonLinesReader reader,
            RecordNormalizer normalizer,
            RecordMerger merger,
            ContextAwareChunker chunker,
            EmbeddingDispatcher embeddingDispatcher,
            VectorStoreAdapter vectorStore,
            @Value("${contextrag.ingest.upsert-batch-size:256}") int upsertBatchSize
    ) {
        this.reader = reader;
        this.normalizer = normalizer;
        this.merger = merger;
        this.chunker = chunker;
        this.embeddingDispatcher = embeddingDispatcher;
        this.vectorStore = vectorStore;
        this.upsertBatchSize = Math.max(1, upsertBatchSize);
    }

    /**
     * @param sources capture files in priority order
     */
    public IngestReport ingest(List<IngestSource> sources) {
        long t0 = System.nanoTime();
        String model = embeddingDispatcher.modelId();
        IngestReport.IngestReportBuilder report = IngestReport.builder()
                .sources(sources.size())
                .embeddingModel(model);

        List<List<CanonicalRecord>> batches = new ArrayList<>(sources.size());
        long lines = 0;
        int unparseable = 0;
        int malformed = 0;

        for (IngestSource source : sources) {
            JsonLinesReader.ReadResult read;
            try {
                read = reader.read(source);
            } catch (IOException e) {
                log.error("event=ingest_aborted stage=read source={} err={}", source.name(), e.getMessage(), e);
                return aborted(report.linesRead(lines).unparseable(unparseable).malformed(malformed),
                        "failed to read " + source.name() + ": " + e.getMessage(), t0);
            }
            lines += read.linesRead();
            unparseable += read.unparseable();

            List<CanonicalRecord> batch = new ArrayList<>(read.items().size());
            for (RawItem item : read.items()) {
                try {
                    batch.add(normalizer.normalize(item));
                } catch (MalformedRecordException e) {
                    malformed++;
                    if (malformed <= MAX_LOGGED_MALFORMED) {
                        log.warn("event=record_malformed source={} line={} reason={}",
                                e.getSourceName(), e.getLineNumber(), e.getMessage());
                    }
                }
            }
            batches.add(batch);
        }
        report.linesRead(lines).unparseable(unparseable).malformed(malformed);
        if (malformed > 0) {
            log.warn("event=records_dropped malformed={} unparseable={}", malformed, unparseable);
        }

        MergeResult merged = merger.merge(batches);
        report.duplicatesCollapsed(merged.duplicatesCollapsed()).records(merged.records().size());

        List<Chunk> chunks = chunker.chunk(merged.records());
        report.chunks(chunks.size());

        EmbeddingRunResult embedded = embeddingDispatcher.embedAll(chunks);
        report.embedded(embedded.embeddedCount()).failed(embedded.failedCount());

        List<VectorRecord> records = toVectorRecords(chunks, embedded.embeddings(), model);
        int upserted = 0;
        int rejected = 0;
        try {
            for (int i = 0; i < records.size(); i += upsertBatchSize) {
                List<VectorRecord> slice = records.subList(i, Math.min(records.size(), i + upsertBatchSize));
                try {
                    vectorStore.upsertAll(slice);
                    upserted += slice.size();
                } catch (VectorRecordRejectedException e) {
                    // isolate the refused records; the rest of the slice is written one by one
                    int accepted = upsertSingly(slice);
                    upserted += accepted;
                    rejected += slice.size() - accepted;
                }
            }
        } catch (VectorStoreUnavailableException e) {
            log.error("event=ingest_aborted stage=upsert upserted={} pending={} err={}",
                    upserted, records.size() - upserted - rejected, e.getMessage());
            return aborted(report.upserted(upserted).rejected(rejected), "vector store unavailable: " + e.getMessage(), t0);
        }

        long ms = (System.nanoTime() - t0) / 1_000_000;
        IngestReport done = report
                .status(IngestReport.Status.OK)
                .upserted(upserted)
                .rejected(rejected)
                .durationMs(ms)
                .build();

        log.info("event=ingest_complete sources={} lines={} unparseable={} malformed={} duplicates={} records={} chunks={} embedded={} failed={} upserted={} rejected={} model={} ms={}",
                done.sources(), done.linesRead(), done.unparseable(), done.malformed(), done.duplicatesCollapsed(),
                done.records(), done.chunks(), done.embedded(), done.failed(), done.upserted(), done.rejected(), model, ms);
        return done;
    }

    private int upsertSingly(List<VectorRecord> slice) {
        int accepted = 0;
        for (VectorRecord r : slice) {
            try {
                vectorStore.upsert(r);
                accepted++;
            } catch (VectorRecordRejectedException e) {
                log.warn("event=vector_record_rejected chunkId={} err={}", r.chunkId(), e.getMessage());
            }
        }
        return accepted;
    }

    private static List<VectorRecord> toVectorRecords(List<Chunk> chunks, Map<String, Embedding> embeddings, String model) {
        List<VectorRecord> out = new ArrayList<>(embeddings.size());
        Set<String> seen = new HashSet<>();
        for (Chunk c : chunks) {
            Embedding e = embeddings.get(c.chunkId());
            if (e == null || !seen.add(c.chunkId())) {
                continue;
            }
            Map<String, Object> md = new LinkedHashMap<>(c.metadata());
            md.put("chunk_id", c.chunkId());
            md.put(EMBEDDING_MODEL_KEY, model);
            if (!c.context().isEmpty()) {
                md.put("context", String.join("\n", c.context()));
            }
            out.add(new VectorRecord(c.chunkId(), e.vector(), md, c.text()));
        }
        return out;
    }

    private static IngestReport aborted(IngestReport.IngestReportBuilder report, String message, long t0) {
        return report
                .status(IngestReport.Status.ABORTED)
                .message(message)
                .durationMs((System.nanoTime() - t0) / 1_000_000)
                .build();
    }
}
