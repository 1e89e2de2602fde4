package com.example.contextrag.infrastructure.config;

import com.example.contextrag.infrastructure.embedding.EmbeddingDispatcher;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

    /**
     * Fixed pool for embedding workers; one thread per configured worker.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService embeddingExecutor(@Value("${contextrag.embedding.workers}") int workers) {
        int threads = EmbeddingDispatcher.resolveWorkers(workers);
        log.info("event=embedding_executor_config threads={}", threads);
        return Executors.newFixedThreadPool(threads);
    }

    /**
     * Runs retrieval and synthesis for queries so the request thread can enforce the overall timeout.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService queryExecutor() {
        int threads = Math.max(4, Runtime.getRuntime().availableProcessors());
        log.info("event=query_executor_config threads={}", threads);
        return Executors.newFixedThreadPool(threads);
    }
}
