package com.example.contextrag.infrastructure.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.contextrag.domain.model.Chunk;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EmbeddingDispatcherTest {

    private ExecutorService executor;
    private FakeEmbeddingClient client;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        client = new FakeEmbeddingClient();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private EmbeddingDispatcher dispatcher(int maxAttempts) {
        return new EmbeddingDispatcher(client, executor, 4, 3, maxAttempts, 1, 2.0, 2);
    }

    private static Chunk chunk(String id, String text) {
        return new Chunk(id, "rec-" + id, 0, 0, text.length(), text, List.of(), Map.of());
    }

    private static List<Chunk> chunks(int n) {
        List<Chunk> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(chunk("c" + i, "chunk text number " + i));
        }
        return out;
    }

    @Test
    void embedsEveryChunkAcrossWorkers() {
        EmbeddingRunResult result = dispatcher(3).embedAll(chunks(20));

        assertEquals(20, result.requested());
        assertEquals(20, result.embeddedCount());
        assertEquals(0, result.failedCount());
        assertEquals(7, client.requests());
        assertEquals("fake-hash-64", result.embeddings().get("c7").model());
        assertArrayEquals(FakeEmbeddingClient.vector("chunk text number 7"), result.embeddings().get("c7").vector());
    }

    @Test
    void transientFailures_areRetriedUntilSuccess() {
        client.failTransiently("number 4", 2);

        EmbeddingRunResult result = dispatcher(3).embedAll(chunks(6));

        assertEquals(6, result.embeddedCount());
        assertEquals(0, result.failedCount());
        assertEquals(3, client.callsFor("chunk text number 4"));
        // the other members of the retried batch are not re-sent
        assertEquals(1, client.callsFor("chunk text number 3"));
    }

    @Test
    void persistentTransientFailure_isReportedAfterMaxAttempts() {
        client.failTransiently("number 2", Integer.MAX_VALUE);

        EmbeddingRunResult result = dispatcher(4).embedAll(chunks(6));

        assertEquals(5, result.embeddedCount());
        assertEquals(1, result.failedCount());
        assertTrue(result.failures().containsKey("c2"));
        assertTrue(result.failures().get("c2").contains("busy"));
        assertEquals(4, client.callsFor("chunk text number 2"));
    }

    @Test
    void permanentFailure_isNotRetried() {
        client.rejectPermanently("number 1");

        EmbeddingRunResult result = dispatcher(4).embedAll(chunks(3));

        assertEquals(2, result.embeddedCount());
        assertEquals(Map.of("c1", "rejected number 1"), result.failures());
        assertEquals(1, client.callsFor("chunk text number 1"));
    }

    @Test
    void duplicateChunkIds_areEmbeddedOnce() {
        List<Chunk> input = List.of(chunk("a", "same text"), chunk("a", "same text"), chunk("b", "other"));

        EmbeddingRunResult result = dispatcher(3).embedAll(input);

        assertEquals(2, result.requested());
        assertEquals(2, result.embeddedCount());
        assertEquals(1, client.callsFor("same text"));
    }

    @Test
    void emptyInput_dispatchesNothing() {
        EmbeddingRunResult result = dispatcher(3).embedAll(List.of());

        assertEquals(0, result.requested());
        assertEquals(0, client.requests());
    }

    @Test
    void embedQuery_retriesThenGivesUpQuietly() {
        client.failTransiently("flaky", 1);
        Optional<float[]> recovered = dispatcher(3).embedQuery("flaky question");
        assertTrue(recovered.isPresent());

        client.failTransiently("down", Integer.MAX_VALUE);
        assertFalse(dispatcher(2).embedQuery("down for good").isPresent());
        assertEquals(2, client.callsFor("down for good"));

        assertFalse(dispatcher(2).embedQuery("  ").isPresent());
    }

    @Test
    void resolveWorkers_defaultsToAtLeastFour() {
        assertEquals(7, EmbeddingDispatcher.resolveWorkers(7));
        assertTrue(EmbeddingDispatcher.resolveWorkers(0) >= 4);
    }
}
