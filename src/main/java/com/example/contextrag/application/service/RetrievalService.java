package com.example.contextrag.application.service;

import com.example.contextrag.domain.model.RetrievalResult;
import com.example.contextrag.domain.model.RetrievedChunk;
import com.example.contextrag.infrastructure.embedding.EmbeddingDispatcher;
import com.example.contextrag.infrastructure.ingest.IngestService;
import com.example.contextrag.infrastructure.vector.MetadataFilter;
import com.example.contextrag.infrastructure.vector.VectorMatch;
import com.example.contextrag.infrastructure.vector.VectorStoreAdapter;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Retrieve-then-rerank: over-fetch {@code kRetrieve} neighbours embedded with the current model,
 * rerank them and keep the best {@code kFinal}.
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final EmbeddingDispatcher embeddingDispatcher;
    private final VectorStoreAdapter vectorStore;
    private final Reranker reranker;

    private final int kRetrieve;
    private final int kFinal;

    public RetrievalService(
            EmbeddingDispatcher embeddingDispatcher,
            VectorStoreAdapter vectorStore,
            Reranker reranker,
            @Value("${contextrag.retrieve.k-retrieve}") int kRetrieve,
            @Value("${contextrag.retrieve.k-final}") int kFinal
    ) {
        if (kFinal <= 0) {
            throw new IllegalArgumentException("k-final must be > 0");
        }
        if (kRetrieve <= kFinal) {
            throw new IllegalArgumentException("k-retrieve must be greater than k-final");
        }
        this.embeddingDispatcher = embeddingDispatcher;
        this.vectorStore = vectorStore;
        this.reranker = reranker;
        this.kRetrieve = kRetrieve;
        this.kFinal = kFinal;
    }

    /**
     * @param source optional {@code source} metadata value to restrict results to
     * @throws com.example.contextrag.infrastructure.vector.VectorStoreUnavailableException when the store cannot be queried
     */
    public RetrievalResult retrieve(String query, String source) {
        long t0 = System.nanoTime();

        Optional<float[]> vector = embeddingDispatcher.embedQuery(query);
        if (vector.isEmpty()) {
            log.warn("event=retrieve_skipped reason=query_not_embedded");
            return RetrievalResult.empty(query);
        }

        MetadataFilter filter = MetadataFilter.eq(IngestService.EMBEDDING_MODEL_KEY, embeddingDispatcher.modelId());
        if (source != null && !source.isBlank()) {
            filter = filter.and("source", source.trim());
        }

        List<VectorMatch> candidates = vectorStore.query(vector.get(), kRetrieve, filter);
        if (candidates.isEmpty()) {
            log.info("event=retrieve_done candidates=0 filter={} ms={}", filter, (System.nanoTime() - t0) / 1_000_000);
            return RetrievalResult.empty(query);
        }

        List<RetrievedChunk> reranked = reranker.rerank(query, candidates);
        List<RetrievedChunk> top = reranked.size() <= kFinal ? reranked : reranked.subList(0, kFinal);

        log.info("event=retrieve_done kRetrieve={} kFinal={} candidates={} returned={} filter={} ms={}",
                kRetrieve, kFinal, candidates.size(), top.size(), filter, (System.nanoTime() - t0) / 1_000_000);
        return new RetrievalResult(query, top, candidates.size());
    }

    public int kRetrieve() {
        return kRetrieve;
    }

    public int kFinal() {
        return kFinal;
    }
}
