package com.example.contextrag.infrastructure.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * Client for an OpenAI-compatible {@code /v1/chat/completions} endpoint.
 */
@Service
public class ChatCompletionAnswerSynthesizer implements AnswerSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionAnswerSynthesizer.class);

    static final String SYSTEM_PROMPT = """
            You are a knowledgeable assistant for a university community: campus life, academics, \
            courses, jobs and student resources.

            Your answers should be:
            - Grounded in the provided sources; cite them as (Source N)
            - Specific and actionable, with concrete details from the context
            - Well structured, professional yet conversational

            If the sources do not answer the question, say so plainly instead of guessing, \
            and mention when information may be limited or outdated.
            """;

    private static final String USER_TEMPLATE = """
            Based on the following sources, answer the user's question.

            Sources:
            {context}

            Question: {question}

            Include:
            1. A direct answer to the question
            2. Relevant details and examples from the sources
            3. Practical next steps when applicable
            4. Important caveats or limitations

            Answer:""";

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    private final boolean enabled;
    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final Duration readTimeout;

    public ChatCompletionAnswerSynthesizer(
            ObjectMapper objectMapper,
            @Value("${contextrag.synthesis.enabled}") boolean enabled,
            @Value("${contextrag.synthesis.base-url}") String baseUrl,
            @Value("${contextrag.synthesis.api-key:}") String apiKey,
            @Value("${contextrag.synthesis.model}") String model,
            @Value("${contextrag.synthesis.temperature}") double temperature,
            @Value("${contextrag.synthesis.max-tokens}") int maxTokens,
            @Value("${contextrag.synthesis.connect-timeout-ms}") int connectTimeoutMs,
            @Value("${contextrag.synthesis.read-timeout-ms}") int readTimeoutMs
    ) {
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.baseUrl = baseUrl == null ? "" : baseUrl.trim();
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.readTimeout = Duration.ofMillis(readTimeoutMs);

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        log.info("event=synthesis_client_config enabled={} baseUrl={} model={} temp={} maxTokens={} connectTimeoutMs={} readTimeoutMs={}",
                enabled, this.baseUrl, model, temperature, maxTokens, connectTimeoutMs, readTimeoutMs);
    }

    @Override
    @Retryable(
            retryFor = {RuntimeException.class},
            noRetryFor = {SynthesisUnavailableException.class, IllegalArgumentException.class},
            maxAttemptsExpression = "#{${contextrag.synthesis.retries:1} + 1}",
            backoff = @Backoff(delay = 300, multiplier = 2.0)
    )
    public String synthesize(String question, String context, Instant deadline) {
        if (!enabled) {
            throw new SynthesisUnavailableException("answer synthesis is disabled");
        }
        if (apiKey.isBlank() || baseUrl.isBlank()) {
            throw new SynthesisUnavailableException("answer synthesis endpoint is not configured");
        }
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question is required");
        }

        Duration timeout = requestTimeout(deadline);

        String user = USER_TEMPLATE
                .replace("{context}", context == null ? "" : context.trim())
                .replace("{question}", question.trim());
        return chat(SYSTEM_PROMPT, user, timeout);
    }

    @Recover
    public String recover(RuntimeException e, String question, String context, Instant deadline) {
        if (e instanceof SynthesisUnavailableException unavailable) {
            throw unavailable;
        }
        if (e instanceof IllegalArgumentException bad) {
            throw bad;
        }
        throw new SynthesisUnavailableException("answer synthesis failed: " + e.getMessage(), e);
    }

    /**
     * The configured read timeout, shortened to what is left before the deadline.
     */
    Duration requestTimeout(Instant deadline) {
        if (deadline == null) {
            return readTimeout;
        }
        Duration left = Duration.between(Instant.now(), deadline);
        if (left.isNegative() || left.isZero()) {
            throw new SynthesisUnavailableException("no time left for answer synthesis");
        }
        return left.compareTo(readTimeout) < 0 ? left : readTimeout;
    }

    private String chat(String system, String user, Duration timeout) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("temperature", temperature);
        payload.put("max_tokens", maxTokens);
        payload.put("messages", List.of(
                Map.of("role", "system", "content", system),
                Map.of("role", "user", "content", user)
        ));

        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize chat request", e);
        }

        URI uri = URI.create(baseUrl.endsWith("/") ? baseUrl + "v1/chat/completions" : baseUrl + "/v1/chat/completions");
        HttpRequest req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        long t0 = System.nanoTime();
        HttpResponse<String> resp;
        try {
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new IllegalStateException("chat completion timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new IllegalStateException("chat completion request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisUnavailableException("chat completion interrupted", e);
        }
        long ms = (System.nanoTime() - t0) / 1_000_000;

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            log.warn("event=synthesis_http_error status={} ms={} body_snip={}",
                    resp.statusCode(), ms, snippet(resp.body()));
            throw new IllegalStateException("chat completion HTTP error: " + resp.statusCode());
        }

        String answer = extractAnswer(objectMapper, resp.body());
        log.info("event=synthesis_ok ms={} chars_out={}", ms, answer.length());
        return answer;
    }

    static String extractAnswer(ObjectMapper objectMapper, String body) {
        Map<?, ?> parsed;
        try {
            parsed = objectMapper.readValue(body, Map.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("chat completion response is not JSON: " + snippet(body), e);
        }
        Object choices = parsed.get("choices");
        if (!(choices instanceof List<?> list) || list.isEmpty()) {
            throw new IllegalStateException("chat completion response missing choices");
        }
        if (!(list.get(0) instanceof Map<?, ?> first)) {
            throw new IllegalStateException("chat completion response invalid choices format");
        }
        if (!(first.get("message") instanceof Map<?, ?> message)) {
            throw new IllegalStateException("chat completion response missing message");
        }
        Object content = message.get("content");
        String answer = content == null ? "" : String.valueOf(content).trim();
        if (answer.isEmpty()) {
            throw new IllegalStateException("chat completion returned empty content");
        }
        return answer;
    }

    private static String snippet(String s) {
        if (s == null) return "";
        String t = s.replaceAll("\\s+", " ").trim();
        return t.length() <= 200 ? t : t.substring(0, 200) + "...";
    }
}
