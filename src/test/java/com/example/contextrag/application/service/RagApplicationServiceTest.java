package com.example.contextrag.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.contextrag.application.analysis.ConfidenceScorer;
import com.example.contextrag.application.analysis.ConfidenceWeights;
import com.example.contextrag.application.analysis.KeywordTopicClassifier;
import com.example.contextrag.application.analysis.QueryAnalyzer;
import com.example.contextrag.application.analysis.TopicCatalog;
import com.example.contextrag.application.analysis.VaguenessDetector;
import com.example.contextrag.domain.dto.QueryRequest;
import com.example.contextrag.domain.dto.QueryResponse;
import com.example.contextrag.domain.dto.StatsResponse;
import com.example.contextrag.domain.model.RetrievalResult;
import com.example.contextrag.domain.model.RetrievedChunk;
import com.example.contextrag.domain.model.VectorRecord;
import com.example.contextrag.infrastructure.embedding.EmbeddingDispatcher;
import com.example.contextrag.infrastructure.embedding.FakeEmbeddingClient;
import com.example.contextrag.infrastructure.ingest.ContextAwareChunker;
import com.example.contextrag.infrastructure.llm.AnswerSynthesizer;
import com.example.contextrag.infrastructure.llm.SynthesisUnavailableException;
import com.example.contextrag.infrastructure.vector.InMemoryVectorStore;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RagApplicationServiceTest {

    private ExecutorService embeddingExecutor;
    private ExecutorService queryExecutor;
    private InMemoryVectorStore store;
    private AnswerSynthesizer synthesizer;
    private EmbeddingDispatcher dispatcher;
    private RetrievalService retrievalService;
    private QueryAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        embeddingExecutor = Executors.newFixedThreadPool(2);
        queryExecutor = Executors.newFixedThreadPool(4);
        store = new InMemoryVectorStore();
        store.open();
        synthesizer = mock(AnswerSynthesizer.class);
        dispatcher = new EmbeddingDispatcher(new FakeEmbeddingClient(), embeddingExecutor, 2, 8, 2, 1, 2.0, 2);
        retrievalService = new RetrievalService(dispatcher, store, new LexicalReranker(0.45, 0.25, 0.15, 0.15, 180), 10, 3);
        TopicCatalog catalog = TopicCatalog.defaultCatalog();
        analyzer = new QueryAnalyzer(new KeywordTopicClassifier(catalog), catalog, new VaguenessDetector());
    }

    @AfterEach
    void tearDown() {
        queryExecutor.shutdownNow();
        embeddingExecutor.shutdownNow();
    }

    private RagApplicationService service(long timeoutMs) {
        return service(retrievalService, queryExecutor, timeoutMs);
    }

    private RagApplicationService service(RetrievalService retrieval, ExecutorService executor, long timeoutMs) {
        return new RagApplicationService(analyzer, retrieval, synthesizer,
                new ConfidenceScorer(ConfidenceWeights.defaults()), store, dispatcher,
                new ContextAwareChunker(1000, 200, 200, 2, 200), executor, timeoutMs, 12000, 5);
    }

    private void put(String id, String title, String text, String source) {
        store.upsert(new VectorRecord(id, FakeEmbeddingClient.vector(title + " " + text), Map.of(
                "source", source,
                "title", title,
                "url", "https://example.edu/" + id,
                "embedding_model", "fake-hash-64",
                "modified_at", "2024-03-01T00:00:00Z"), text));
    }

    private void seedJobs() {
        put("j1", "Good job options on campus", "The library and the dining halls hire students for a good job every semester.", "reddit");
        put("j2", "Student job board", "Search the student job board for on-campus and off-campus openings.", "asu_web");
        put("p1", "Parking permits", "Parking permits go on sale in July.", "asu_web");
    }

    private static QueryRequest ask(String question) {
        return QueryRequest.builder().question(question).build();
    }

    @Test
    void vagueQuestion_isAnsweredWithClarificationsAndSources() {
        seedJobs();
        when(synthesizer.synthesize(eq("I want a good job"), contains("Source 1 ("), any(Instant.class))).thenReturn("Check the student job board (Source 1).");

        QueryResponse r = service(5000).ask(ask("I want a good job"));

        assertEquals("Check the student job board (Source 1).", r.getAnswer());
        assertEquals(TopicCatalog.JOBS, r.getCategory());
        assertTrue(r.isNeedsClarification());
        assertEquals(2, r.getClarificationQuestions().size());
        assertEquals("job_location", r.getClarificationQuestions().get(0).getFieldName());
        assertFalse(r.getClarificationQuestions().get(0).getOptions().isEmpty());
        assertFalse(r.isIncomplete());
        assertFalse(r.getSources().isEmpty());
        assertTrue(r.getSources().size() <= 3);
        QueryResponse.SourceDto top = r.getSources().get(0);
        assertTrue(top.getTitle().toLowerCase(Locale.ROOT).contains("job"));
        assertTrue(top.getUrl().startsWith("https://example.edu/"));
        assertTrue(top.getScore() >= 0.0 && top.getScore() <= 1.0);
        assertFalse(r.getFollowUpQuestions().isEmpty());
        assertFalse(r.getActionItems().isEmpty());
        assertTrue(r.getConfidenceScore() >= 0.0 && r.getConfidenceScore() <= 1.0);
    }

    @Test
    void emptyStore_givesNoResultsAnswerWithLowConfidence() {
        QueryResponse r = service(5000).ask(ask("What's the best parking lot?"));

        assertEquals(RagApplicationService.NO_RESULTS_ANSWER, r.getAnswer());
        assertTrue(r.getConfidenceScore() < 0.3);
        assertEquals("LOW", r.getConfidenceTier());
        assertTrue(r.getSources().isEmpty());
        assertFalse(r.isIncomplete());
        verify(synthesizer, never()).synthesize(anyString(), anyString(), any(Instant.class));
    }

    @Test
    void synthesisUnavailable_fallsBackToPassages() {
        seedJobs();
        when(synthesizer.synthesize(anyString(), anyString(), any(Instant.class)))
                .thenThrow(new SynthesisUnavailableException("answer synthesis is disabled"));

        QueryResponse r = service(5000).ask(ask("Where is the student job board?"));

        assertTrue(r.getAnswer().startsWith(RagApplicationService.SYNTHESIS_FALLBACK_NOTE));
        assertTrue(r.getAnswer().contains("1. "));
        assertTrue(r.getConfidenceScore() <= 0.5);
        assertFalse(r.isIncomplete());
        assertFalse(r.getSources().isEmpty());
    }

    @Test
    void slowSynthesis_timesOutWithPartialAnswer() {
        seedJobs();
        when(synthesizer.synthesize(anyString(), anyString(), any(Instant.class))).thenAnswer(inv -> {
            Thread.sleep(5000);
            return "too late";
        });

        long t0 = System.currentTimeMillis();
        QueryResponse r = service(300).ask(ask("Where is the student job board?"));

        assertTrue(System.currentTimeMillis() - t0 < 4000);
        assertTrue(r.isIncomplete());
        assertTrue(r.getAnswer().startsWith(RagApplicationService.TIMEOUT_FALLBACK_NOTE));
        assertFalse(r.getSources().isEmpty());
    }

    @Test
    void timedOutSynthesis_releasesItsThreadForTheNextQuery() {
        seedJobs();
        when(synthesizer.synthesize(anyString(), anyString(), any(Instant.class))).thenAnswer(inv -> {
            Thread.sleep(5000);
            return "too late";
        });
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            RagApplicationService service = service(retrievalService, single, 1000);

            long t0 = System.currentTimeMillis();
            QueryResponse first = service.ask(ask("Where is the student job board?"));
            QueryResponse second = service.ask(ask("Where is the student job board?"));

            assertTrue(System.currentTimeMillis() - t0 < 4500);
            assertTrue(first.isIncomplete());
            assertFalse(first.getSources().isEmpty());
            assertTrue(second.isIncomplete());
            assertFalse(second.getSources().isEmpty());
            assertTrue(second.getAnswer().startsWith(RagApplicationService.TIMEOUT_FALLBACK_NOTE));
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void slowRetrieval_isReportedAsTimeoutNotAsNoResults() {
        RetrievalService slow = mock(RetrievalService.class);
        when(slow.retrieve(anyString(), any())).thenAnswer(inv -> {
            Thread.sleep(5000);
            return RetrievalResult.empty("late");
        });

        long t0 = System.currentTimeMillis();
        QueryResponse r = service(slow, queryExecutor, 300).ask(ask("Where is the student job board?"));

        assertTrue(System.currentTimeMillis() - t0 < 4000);
        assertTrue(r.isIncomplete());
        assertEquals(RagApplicationService.TIMEOUT_NO_PASSAGES_ANSWER, r.getAnswer());
        assertTrue(r.getAnswer().startsWith(RagApplicationService.TIMEOUT_NOTE));
        assertTrue(r.getSources().isEmpty());
        assertTrue(r.getConfidenceScore() < 0.3);
        verify(synthesizer, never()).synthesize(anyString(), anyString(), any(Instant.class));
    }

    @Test
    void unavailableStore_degradesInsteadOfFailing() {
        seedJobs();
        store.close();

        QueryResponse r = service(5000).ask(ask("I want a good job"));

        assertEquals(RagApplicationService.STORE_UNAVAILABLE_ANSWER, r.getAnswer());
        assertTrue(r.isIncomplete());
        assertTrue(r.getConfidenceScore() < 0.3);
        assertTrue(r.getSources().isEmpty());
        assertTrue(r.isNeedsClarification());
    }

    @Test
    void priorAnswers_shrinkClarifications() {
        seedJobs();
        when(synthesizer.synthesize(anyString(), anyString(), any(Instant.class))).thenReturn("ok");
        QueryRequest request = QueryRequest.builder()
                .question("I want a good job")
                .priorAnswers(Map.of("major", "Computer Science"))
                .build();

        QueryResponse r = service(5000).ask(request);

        assertEquals(1, r.getClarificationQuestions().size());
        assertEquals("job_location", r.getClarificationQuestions().get(0).getFieldName());
    }

    @Test
    void sourceFilter_limitsSources() {
        seedJobs();
        when(synthesizer.synthesize(anyString(), anyString(), any(Instant.class))).thenReturn("ok");
        QueryRequest request = QueryRequest.builder().question("student job board").source("asu_web").build();

        QueryResponse r = service(5000).ask(request);

        assertFalse(r.getSources().isEmpty());
        assertTrue(r.getSources().stream().allMatch(s -> "asu_web".equals(s.getSource())));
    }

    @Test
    void blankQuestion_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> service(5000).ask(ask("   ")));
    }

    @Test
    void stats_reportStoreAndPipelineSettings() {
        seedJobs();

        StatsResponse stats = service(5000).stats();

        assertEquals(InMemoryVectorStore.BACKEND, stats.getBackend());
        assertEquals(3, stats.getTotalRecords());
        assertEquals(FakeEmbeddingClient.DIMENSIONS, stats.getDimensions());
        assertEquals(Map.of("reddit", 1L, "asu_web", 2L), stats.getRecordsBySource());
        assertEquals("fake-hash-64", stats.getEmbeddingModel());
        assertEquals(1000, stats.getChunkMaxSize());
        assertEquals(10, stats.getRetrieveCandidates());
        assertEquals(3, stats.getRetrieveFinal());
    }

    @Test
    void buildContext_labelsSourcesAndRespectsLimits() {
        List<RetrievedChunk> chunks = List.of(
                new RetrievedChunk("a", "First passage.", Map.of("source", "reddit", "title", "Jobs thread",
                        "context", "Original post | Any jobs?"), 0.9, 0.8),
                new RetrievedChunk("b", "Second passage.", Map.of("source", "asu_web", "title", "Careers",
                        "url", "https://example.edu/careers"), 0.8, 0.7),
                new RetrievedChunk("c", "Third passage.", Map.of(), 0.7, 0.6));

        String context = RagApplicationService.buildContext(chunks, 2, 12000);

        assertEquals("Source 1 (reddit): Jobs thread\nThread context:\nOriginal post | Any jobs?\nFirst passage.\n\n"
                + "Source 2 (asu_web): Careers [URL: https://example.edu/careers]\nSecond passage.", context);
        assertEquals("", RagApplicationService.buildContext(List.of(), 5, 12000));
    }

    @Test
    void preview_truncatesLongContent() {
        String longText = "x".repeat(250);

        assertEquals(203, RagApplicationService.preview(longText).length());
        assertEquals("short", RagApplicationService.preview("  short "));
    }
}
