package com.example.contextrag.infrastructure.embedding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

/**
 * {@link EmbeddingClient} over a Spring AI {@link EmbeddingModel} (Ollama by default).
 * Exceptions are translated into per-text outcomes; nothing is thrown to the dispatcher.
 */
@Component
public class SpringAiEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingClient.class);

    private final EmbeddingModel embeddingModel;
    private final String modelId;
    private final int expectedDimensions;

    public SpringAiEmbeddingClient(
            EmbeddingModel embeddingModel,
            @Value("${contextrag.embedding.model}") String modelId,
            @Value("${contextrag.embedding.dimensions:0}") int expectedDimensions
    ) {
        this.embeddingModel = embeddingModel;
        this.modelId = modelId;
        this.expectedDimensions = Math.max(0, expectedDimensions);
        log.info("event=embedding_client_config model={} dimensions={}", modelId, expectedDimensions);
    }

    @Override
    public String modelId() {
        return modelId;
    }

    @Override
    public List<EmbeddingOutcome> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        EmbeddingOutcome[] out = new EmbeddingOutcome[texts.size()];
        List<Integer> positions = new ArrayList<>(texts.size());
        List<String> sendable = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            String t = texts.get(i);
            if (t == null || t.isBlank()) {
                out[i] = EmbeddingOutcome.permanentFailure("blank text");
            } else {
                positions.add(i);
                sendable.add(t);
            }
        }

        if (!sendable.isEmpty()) {
            List<EmbeddingOutcome> sent = call(sendable);
            for (int j = 0; j < positions.size(); j++) {
                out[positions.get(j)] = sent.get(j);
            }
        }
        return List.of(out);
    }

    private List<EmbeddingOutcome> call(List<String> texts) {
        try {
            List<float[]> vectors = embeddingModel.embed(texts);
            if (vectors == null || vectors.size() != texts.size()) {
                int got = vectors == null ? 0 : vectors.size();
                return Collections.nCopies(texts.size(),
                        EmbeddingOutcome.transientFailure("expected " + texts.size() + " vectors, got " + got));
            }
            List<EmbeddingOutcome> out = new ArrayList<>(texts.size());
            for (float[] v : vectors) {
                out.add(validate(v));
            }
            return out;
        } catch (NonTransientAiException e) {
            if (texts.size() > 1) {
                // one bad text rejects the whole request; retry singly to isolate it
                log.warn("event=embedding_batch_rejected size={} err={}", texts.size(), e.getMessage());
                List<EmbeddingOutcome> out = new ArrayList<>(texts.size());
                for (String t : texts) {
                    out.add(call(List.of(t)).get(0));
                }
                return out;
            }
            return List.of(EmbeddingOutcome.permanentFailure(describe(e)));
        } catch (TransientAiException | ResourceAccessException e) {
            return Collections.nCopies(texts.size(), EmbeddingOutcome.transientFailure(describe(e)));
        } catch (RuntimeException e) {
            String reason = describe(e);
            log.warn("event=embedding_call_failed size={} err={}", texts.size(), reason);
            return Collections.nCopies(texts.size(), EmbeddingOutcome.transientFailure(reason));
        }
    }

    private EmbeddingOutcome validate(float[] v) {
        if (v == null || v.length == 0) {
            return EmbeddingOutcome.permanentFailure("empty vector");
        }
        if (expectedDimensions > 0 && v.length != expectedDimensions) {
            return EmbeddingOutcome.permanentFailure(
                    "dimension mismatch: expected " + expectedDimensions + ", got " + v.length);
        }
        return EmbeddingOutcome.success(v);
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
