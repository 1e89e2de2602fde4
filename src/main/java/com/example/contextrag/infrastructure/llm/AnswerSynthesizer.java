package com.example.contextrag.infrastructure.llm;

import java.time.Instant;

/**
 * External answer synthesis: question plus source-attributed context in, free text out.
 */
public interface AnswerSynthesizer {

    /**
     * @param deadline no request may outlive this instant
     * @throws SynthesisUnavailableException when the endpoint is disabled, unconfigured, failing or too slow
     */
    String synthesize(String question, String context, Instant deadline);
}
