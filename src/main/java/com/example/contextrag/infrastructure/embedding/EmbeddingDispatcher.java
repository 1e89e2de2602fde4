package com.example.contextrag.infrastructure.embedding;

import com.example.contextrag.domain.model.Chunk;
import com.example.contextrag.domain.model.Embedding;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.RecoveryCallback;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Fans chunks out to a fixed set of workers and collects embeddings keyed by chunk id.
 *
 * <p>Sub-batches sit in a bounded queue; each worker drains it until empty. Transient
 * failures are retried with exponential backoff and jitter, at most {@code maxAttempts}
 * times per sub-batch; whatever is still failing afterwards is reported, never thrown.
 */
@Service
public class EmbeddingDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingDispatcher.class);

    private final EmbeddingClient client;
    private final ExecutorService executor;
    private final int workers;
    private final int batchSize;
    private final int maxAttempts;
    private final RetryTemplate retryTemplate;

    public EmbeddingDispatcher(
            EmbeddingClient client,
            @Qualifier("embeddingExecutor") ExecutorService executor,
            @Value("${contextrag.embedding.workers}") int workers,
            @Value("${contextrag.embedding.batch-size}") int batchSize,
            @Value("${contextrag.embedding.max-attempts}") int maxAttempts,
            @Value("${contextrag.embedding.backoff-initial-ms}") long backoffInitialMs,
            @Value("${contextrag.embedding.backoff-multiplier}") double backoffMultiplier,
            @Value("${contextrag.embedding.backoff-max-ms}") long backoffMaxMs
    ) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.client = client;
        this.executor = executor;
        this.workers = resolveWorkers(workers);
        this.batchSize = batchSize;
        this.maxAttempts = maxAttempts;
        long initialMs = Math.max(1, backoffInitialMs);
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialMs, Math.max(1.1, backoffMultiplier),
                        Math.max(initialMs + 1, backoffMaxMs), true)
                .retryOn(TransientEmbeddingException.class)
                .build();

        log.info("event=embedding_dispatcher_config model={} workers={} batchSize={} maxAttempts={} backoffMs={}..{}",
                client.modelId(), this.workers, batchSize, maxAttempts, backoffInitialMs, backoffMaxMs);
    }

    /**
     * Worker count used when none is configured: {@code max(4, availableProcessors)}.
     */
    public static int resolveWorkers(int configured) {
        return configured > 0 ? configured : Math.max(4, Runtime.getRuntime().availableProcessors());
    }

    public String modelId() {
        return client.modelId();
    }

    public EmbeddingRunResult embedAll(List<Chunk> chunks) {
        long t0 = System.nanoTime();

        Map<String, Chunk> distinct = new LinkedHashMap<>();
        for (Chunk c : chunks) {
            distinct.putIfAbsent(c.chunkId(), c);
        }
        if (distinct.isEmpty()) {
            return new EmbeddingRunResult(Map.of(), Map.of(), 0, 0);
        }

        List<List<Chunk>> batches = partition(new ArrayList<>(distinct.values()), batchSize);
        BlockingQueue<List<Chunk>> queue = new ArrayBlockingQueue<>(batches.size());
        queue.addAll(batches);

        ConcurrentMap<String, Embedding> embeddings = new ConcurrentHashMap<>();
        ConcurrentMap<String, String> failures = new ConcurrentHashMap<>();

        int loops = Math.min(workers, batches.size());
        List<CompletableFuture<Void>> running = new ArrayList<>(loops);
        for (int i = 0; i < loops; i++) {
            running.add(CompletableFuture.runAsync(() -> drain(queue, embeddings, failures), executor));
        }
        CompletableFuture.allOf(running.toArray(new CompletableFuture[0])).join();

        long ms = (System.nanoTime() - t0) / 1_000_000;
        log.info("event=embedding_run_done chunks={} batches={} workers={} embedded={} failed={} ms={}",
                distinct.size(), batches.size(), loops, embeddings.size(), failures.size(), ms);
        if (!failures.isEmpty()) {
            log.warn("event=embedding_run_failures failed={} sample={}",
                    failures.size(), failures.entrySet().iterator().next());
        }
        return new EmbeddingRunResult(embeddings, failures, distinct.size(), ms);
    }

    /**
     * Embeds a question through the same client and retry policy used for the corpus.
     *
     * @return empty when the text could not be embedded
     */
    public Optional<float[]> embedQuery(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        RetryCallback<Optional<float[]>, RuntimeException> attempt = ctx -> {
            List<EmbeddingOutcome> out = client.embed(List.of(text));
            if (out == null || out.size() != 1) {
                throw new TransientEmbeddingException("expected one outcome for query");
            }
            EmbeddingOutcome o = out.get(0);
            if (o instanceof EmbeddingOutcome.Success s) {
                return Optional.of(s.vector());
            }
            if (o instanceof EmbeddingOutcome.TransientFailure t) {
                throw new TransientEmbeddingException(t.reason());
            }
            log.warn("event=query_embedding_rejected reason={}", ((EmbeddingOutcome.PermanentFailure) o).reason());
            return Optional.empty();
        };
        RecoveryCallback<Optional<float[]>> giveUp = ctx -> {
            Throwable last = ctx.getLastThrowable();
            log.warn("event=query_embedding_failed attempts={} err={}",
                    ctx.getRetryCount(), last == null ? "unknown" : last.getMessage());
            return Optional.empty();
        };
        return retryTemplate.execute(attempt, giveUp);
    }

    private void drain(BlockingQueue<List<Chunk>> queue,
                       ConcurrentMap<String, Embedding> embeddings,
                       ConcurrentMap<String, String> failures) {
        List<Chunk> batch;
        while ((batch = queue.poll()) != null) {
            try {
                embedBatch(batch, embeddings, failures);
            } catch (RuntimeException e) {
                log.error("event=embedding_batch_error size={} err={}", batch.size(), e.toString(), e);
                for (Chunk c : batch) {
                    if (!embeddings.containsKey(c.chunkId())) {
                        failures.putIfAbsent(c.chunkId(), "dispatch error: " + e.getMessage());
                    }
                }
            }
        }
    }

    private void embedBatch(List<Chunk> batch,
                            ConcurrentMap<String, Embedding> embeddings,
                            ConcurrentMap<String, String> failures) {
        Map<String, Chunk> pending = new LinkedHashMap<>();
        for (Chunk c : batch) {
            pending.put(c.chunkId(), c);
        }
        Map<String, String> lastReason = new HashMap<>();

        RetryCallback<Void, RuntimeException> attempt = ctx -> {
            List<Chunk> sent = new ArrayList<>(pending.values());
            List<String> texts = new ArrayList<>(sent.size());
            for (Chunk c : sent) {
                texts.add(c.embeddingText());
            }

            List<EmbeddingOutcome> outcomes = client.embed(texts);
            if (outcomes == null || outcomes.size() != sent.size()) {
                throw new TransientEmbeddingException("expected " + sent.size() + " outcomes, got "
                        + (outcomes == null ? 0 : outcomes.size()));
            }

            for (int i = 0; i < sent.size(); i++) {
                String id = sent.get(i).chunkId();
                EmbeddingOutcome o = outcomes.get(i);
                if (o instanceof EmbeddingOutcome.Success s) {
                    embeddings.put(id, new Embedding(id, s.vector(), client.modelId()));
                    pending.remove(id);
                } else if (o instanceof EmbeddingOutcome.PermanentFailure p) {
                    failures.put(id, p.reason());
                    pending.remove(id);
                } else if (o instanceof EmbeddingOutcome.TransientFailure t) {
                    lastReason.put(id, t.reason());
                }
            }

            if (!pending.isEmpty()) {
                log.debug("event=embedding_retry attempt={} pending={}", ctx.getRetryCount() + 1, pending.size());
                throw new TransientEmbeddingException(pending.size() + " texts still failing");
            }
            return null;
        };

        RecoveryCallback<Void> giveUp = ctx -> {
            Throwable last = ctx.getLastThrowable();
            String fallback = last == null ? "unknown" : last.getMessage();
            for (String id : pending.keySet()) {
                failures.put(id, lastReason.getOrDefault(id, fallback) + " (after " + ctx.getRetryCount() + " attempts)");
            }
            log.warn("event=embedding_retries_exhausted maxAttempts={} failed={}", maxAttempts, pending.size());
            return null;
        };

        retryTemplate.execute(attempt, giveUp);
    }

    private static List<List<Chunk>> partition(List<Chunk> items, int size) {
        List<List<Chunk>> out = new ArrayList<>((items.size() + size - 1) / size);
        for (int i = 0; i < items.size(); i += size) {
            out.add(items.subList(i, Math.min(items.size(), i + size)));
        }
        return out;
    }
}
