package com.example.contextrag.infrastructure.config;

import com.example.contextrag.application.analysis.ConfidenceWeights;
import com.example.contextrag.application.analysis.TopicCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

    @Bean
    public TopicCatalog topicCatalog() {
        TopicCatalog catalog = TopicCatalog.defaultCatalog();
        log.info("event=topic_catalog_config categories={}", catalog.categories().size());
        return catalog;
    }

    @Bean
    public ConfidenceWeights confidenceWeights(
            @Value("${contextrag.query.confidence.similarity-weight}") double similarity,
            @Value("${contextrag.query.confidence.coverage-weight}") double coverage,
            @Value("${contextrag.query.confidence.category-weight}") double category,
            @Value("${contextrag.query.confidence.vagueness-penalty}") double vaguenessPenalty,
            @Value("${contextrag.query.confidence.timeout-penalty}") double timeoutPenalty,
            @Value("${contextrag.query.confidence.synthesis-cap}") double synthesisCap,
            @Value("${contextrag.query.confidence.empty-retrieval-cap}") double emptyRetrievalCap,
            @Value("${contextrag.query.confidence.top-n}") int topN,
            @Value("${contextrag.query.relevance-threshold}") double relevanceThreshold,
            @Value("${contextrag.query.coverage-target}") int coverageTarget
    ) {
        ConfidenceWeights weights = new ConfidenceWeights(similarity, coverage, category, vaguenessPenalty,
                timeoutPenalty, synthesisCap, emptyRetrievalCap, topN, relevanceThreshold, coverageTarget);
        log.info("event=confidence_config weights={}", weights);
        return weights;
    }
}
