package com.example.contextrag.application.service;

import com.example.contextrag.application.analysis.ConfidenceScorer;
import com.example.contextrag.application.analysis.QueryAnalyzer;
import com.example.contextrag.domain.dto.QueryRequest;
import com.example.contextrag.domain.dto.QueryResponse;
import com.example.contextrag.domain.dto.StatsResponse;
import com.example.contextrag.domain.model.ClarificationQuestion;
import com.example.contextrag.domain.model.ConfidenceTier;
import com.example.contextrag.domain.model.QueryAnalysis;
import com.example.contextrag.domain.model.RetrievalResult;
import com.example.contextrag.domain.model.RetrievedChunk;
import com.example.contextrag.infrastructure.embedding.EmbeddingDispatcher;
import com.example.contextrag.infrastructure.ingest.ContextAwareChunker;
import com.example.contextrag.infrastructure.llm.AnswerSynthesizer;
import com.example.contextrag.infrastructure.llm.SynthesisUnavailableException;
import com.example.contextrag.infrastructure.vector.VectorStoreAdapter;
import com.example.contextrag.infrastructure.vector.VectorStoreStats;
import com.example.contextrag.infrastructure.vector.VectorStoreUnavailableException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Query pipeline:
 * analyze -> retrieve + rerank -> build context -> synthesize -> score confidence.
 *
 * <p>Retrieval and synthesis run on the query executor under one overall deadline. A stage that
 * misses the deadline is cancelled with an interrupt so it gives its thread back. A missed
 * deadline, an unreachable store or a failing synthesizer degrade the answer instead of failing
 * the request.
 */
@Service
public class RagApplicationService {

    private static final Logger log = LoggerFactory.getLogger(RagApplicationService.class);

    static final String NO_RESULTS_ANSWER =
            "I couldn't find any relevant information to answer your question. "
                    + "Try rephrasing it or adding more detail.";
    static final String STORE_UNAVAILABLE_ANSWER =
            "The knowledge base is temporarily unavailable, so I can't answer right now. Please try again shortly.";
    static final String SYNTHESIS_FALLBACK_NOTE =
            "Answer generation is currently unavailable. These are the most relevant passages I found:";
    static final String TIMEOUT_NOTE = "The full answer could not be completed in time.";
    static final String TIMEOUT_FALLBACK_NOTE = TIMEOUT_NOTE + " These are the most relevant passages I found:";
    static final String TIMEOUT_NO_PASSAGES_ANSWER = TIMEOUT_NOTE + " Please try again shortly.";

    private static final int PREVIEW_CHARS = 200;

    private final QueryAnalyzer queryAnalyzer;
    private final RetrievalService retrievalService;
    private final AnswerSynthesizer answerSynthesizer;
    private final ConfidenceScorer confidenceScorer;
    private final VectorStoreAdapter vectorStore;
    private final EmbeddingDispatcher embeddingDispatcher;
    private final ContextAwareChunker chunker;
    private final ExecutorService executor;

    private final long timeoutMs;
    private final int maxContextChars;
    private final int maxContextChunks;

    public RagApplicationService(
            QueryAnalyzer queryAnalyzer,
            RetrievalService retrievalService,
            AnswerSynthesizer answerSynthesizer,
            ConfidenceScorer confidenceScorer,
            VectorStoreAdapter vectorStore,
            EmbeddingDispatcher embeddingDispatcher,
            ContextAwareChunker chunker,
            @Qualifier("queryExecutor") ExecutorService executor,
            @Value("${contextrag.query.timeout-ms}") long timeoutMs,
            @Value("${contextrag.context.max-chars}") int maxContextChars,
            @Value("${contextrag.context.max-chunks}") int maxContextChunks
    ) {
        this.queryAnalyzer = queryAnalyzer;
        this.retrievalService = retrievalService;
        this.answerSynthesizer = answerSynthesizer;
        this.confidenceScorer = confidenceScorer;
        this.vectorStore = vectorStore;
        this.embeddingDispatcher = embeddingDispatcher;
        this.chunker = chunker;
        this.executor = executor;
        this.timeoutMs = Math.max(1, timeoutMs);
        this.maxContextChars = Math.max(500, maxContextChars);
        this.maxContextChunks = Math.max(1, maxContextChunks);
    }

    public QueryResponse ask(QueryRequest request) {
        long t0 = System.nanoTime();
        long deadline = t0 + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        Instant wallDeadline = Instant.now().plusMillis(timeoutMs);

        String question = request.getQuestion() == null ? "" : request.getQuestion().trim();
        if (question.isEmpty()) {
            throw new IllegalArgumentException("question is required");
        }
        Map<String, String> prior = request.getPriorAnswers() == null ? Map.of() : request.getPriorAnswers();

        QueryAnalysis analysis = queryAnalyzer.analyze(question, prior);
        String retrievalQuery = queryAnalyzer.retrievalQuery(question, prior);

        boolean timedOut = false;
        boolean storeUnavailable = false;
        boolean synthesized = false;
        RetrievalResult retrieval;

        try {
            retrieval = await(executor.submit(
                    () -> retrievalService.retrieve(retrievalQuery, request.getSource())), deadline);
        } catch (TimeoutException e) {
            log.warn("event=query_timeout stage=retrieve timeoutMs={}", timeoutMs);
            retrieval = RetrievalResult.empty(retrievalQuery);
            timedOut = true;
        } catch (VectorStoreUnavailableException e) {
            log.warn("event=query_store_unavailable err={}", e.getMessage());
            retrieval = RetrievalResult.empty(retrievalQuery);
            storeUnavailable = true;
        }

        String answer;
        if (storeUnavailable) {
            answer = STORE_UNAVAILABLE_ANSWER;
        } else if (timedOut) {
            answer = TIMEOUT_NO_PASSAGES_ANSWER;
        } else if (retrieval.isEmpty()) {
            answer = NO_RESULTS_ANSWER;
        } else {
            String context = buildContext(retrieval.chunks(), maxContextChunks, maxContextChars);
            try {
                answer = await(executor.submit(
                        () -> answerSynthesizer.synthesize(question, context, wallDeadline)), deadline);
                synthesized = true;
            } catch (TimeoutException e) {
                log.warn("event=query_timeout stage=synthesize timeoutMs={}", timeoutMs);
                answer = fallbackAnswer(TIMEOUT_FALLBACK_NOTE, retrieval);
                timedOut = true;
            } catch (SynthesisUnavailableException e) {
                log.warn("event=synthesis_fallback err={}", e.getMessage());
                answer = fallbackAnswer(SYNTHESIS_FALLBACK_NOTE, retrieval);
            }
        }

        double confidence = confidenceScorer.score(new ConfidenceScorer.Signals(
                retrieval, analysis.categoryConfidence(), analysis.vague(), synthesized, timedOut));

        QueryResponse response = QueryResponse.builder()
                .answer(answer)
                .confidenceScore(confidence)
                .confidenceTier(ConfidenceTier.of(confidence).name())
                .category(analysis.category())
                .needsClarification(analysis.needsClarification())
                .incomplete(timedOut || storeUnavailable)
                .clarificationQuestions(toDtos(analysis.clarificationQuestions()))
                .followUpQuestions(analysis.followUpQuestions())
                .actionItems(analysis.actionItems())
                .relatedTopics(analysis.relatedTopics())
                .sources(toSources(retrieval.chunks()))
                .build();

        log.info("event=rag_query_done category={} vague={} retrieved={} candidates={} synthesized={} timedOut={} storeUnavailable={} confidence={} ms={}",
                analysis.category(), analysis.vague(), retrieval.size(), retrieval.candidateCount(),
                synthesized, timedOut, storeUnavailable, String.format("%.3f", confidence),
                (System.nanoTime() - t0) / 1_000_000);
        return response;
    }

    public StatsResponse stats() {
        VectorStoreStats stats = vectorStore.stats();
        return StatsResponse.builder()
                .backend(stats.backend())
                .totalRecords(stats.recordCount())
                .dimensions(stats.dimensions())
                .recordsBySource(stats.countsBySource())
                .embeddingModel(embeddingDispatcher.modelId())
                .chunkMaxSize(chunker.maxSize())
                .chunkOverlap(chunker.overlap())
                .retrieveCandidates(retrievalService.kRetrieve())
                .retrieveFinal(retrievalService.kFinal())
                .build();
    }

    /**
     * Waits until the deadline, then cancels the task with an interrupt. Failures of the task
     * are rethrown unwrapped.
     */
    private static <T> T await(Future<T> future, long deadlineNanos) throws TimeoutException {
        long remaining = deadlineNanos - System.nanoTime();
        try {
            if (remaining <= 0) {
                throw new TimeoutException("deadline already passed");
            }
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("query interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("query stage failed", cause);
        }
    }

    static String buildContext(List<RetrievedChunk> chunks, int maxChunks, int maxChars) {
        if (chunks == null || chunks.isEmpty()) return "";

        List<String> parts = new ArrayList<>();
        int used = 0;

        for (RetrievedChunk c : chunks) {
            if (parts.size() >= maxChunks) break;

            String content = c.content() == null ? "" : c.content().trim();
            if (content.isEmpty()) continue;

            StringBuilder header = new StringBuilder("Source ").append(parts.size() + 1)
                    .append(" (").append(text(c.metadata(), "source", "unknown")).append("): ")
                    .append(text(c.metadata(), "title", "Untitled"));
            String url = text(c.metadata(), "url", null);
            if (url != null) {
                header.append(" [URL: ").append(url).append(']');
            }
            String thread = text(c.metadata(), "context", null);
            String block = header + "\n"
                    + (thread == null ? "" : "Thread context:\n" + thread + "\n")
                    + content;

            if (used + block.length() + 2 > maxChars) {
                int remaining = maxChars - used - 2;
                if (remaining > 200) {
                    parts.add(block.substring(0, Math.min(block.length(), remaining)));
                }
                break;
            }

            parts.add(block);
            used += block.length() + 2;
        }

        return String.join("\n\n", parts);
    }

    private static String fallbackAnswer(String note, RetrievalResult retrieval) {
        StringBuilder sb = new StringBuilder(note);
        int i = 1;
        for (RetrievedChunk c : retrieval.chunks()) {
            sb.append("\n\n").append(i++).append(". ")
                    .append(text(c.metadata(), "title", "Untitled")).append(": ")
                    .append(preview(c.content()));
        }
        return sb.toString();
    }

    private static List<QueryResponse.SourceDto> toSources(List<RetrievedChunk> chunks) {
        List<QueryResponse.SourceDto> out = new ArrayList<>(chunks.size());
        for (RetrievedChunk c : chunks) {
            out.add(QueryResponse.SourceDto.builder()
                    .title(text(c.metadata(), "title", "Untitled"))
                    .url(text(c.metadata(), "url", null))
                    .score(c.rerankScore())
                    .contentPreview(preview(c.content()))
                    .source(text(c.metadata(), "source", "unknown"))
                    .build());
        }
        return out;
    }

    private static List<QueryResponse.ClarificationQuestionDto> toDtos(List<ClarificationQuestion> questions) {
        List<QueryResponse.ClarificationQuestionDto> out = new ArrayList<>(questions.size());
        for (ClarificationQuestion q : questions) {
            out.add(QueryResponse.ClarificationQuestionDto.builder()
                    .question(q.question())
                    .options(q.options())
                    .context(q.context())
                    .fieldName(q.fieldName())
                    .build());
        }
        return out;
    }

    static String preview(String content) {
        if (content == null) return "";
        String t = content.trim();
        return t.length() <= PREVIEW_CHARS ? t : t.substring(0, PREVIEW_CHARS) + "...";
    }

    private static String text(Map<String, Object> metadata, String key, String fallback) {
        Object v = metadata == null ? null : metadata.get(key);
        if (v == null || String.valueOf(v).isBlank()) {
            return fallback;
        }
        return String.valueOf(v);
    }
}
