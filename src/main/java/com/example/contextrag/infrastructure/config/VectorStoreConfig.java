package com.example.contextrag.infrastructure.config;

import com.example.contextrag.infrastructure.vector.InMemoryVectorStore;
import com.example.contextrag.infrastructure.vector.PgVectorStoreAdapter;
import com.example.contextrag.infrastructure.vector.VectorStoreAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Selects the vector store backend. The handle is opened when the context starts; a store
 * that cannot be opened fails startup.
 */
@Configuration
public class VectorStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreConfig.class);

    @Bean(initMethod = "open", destroyMethod = "close")
    @ConditionalOnProperty(name = "contextrag.vector-store.backend", havingValue = "pgvector", matchIfMissing = true)
    public VectorStoreAdapter pgVectorStore(
            JdbcTemplate jdbcTemplate,
            ObjectMapper objectMapper,
            @Value("${contextrag.vector-store.pgvector.table}") String table,
            @Value("${contextrag.vector-store.pgvector.dimensions}") int dimensions,
            @Value("${contextrag.vector-store.pgvector.initialize-schema}") boolean initializeSchema
    ) {
        log.info("event=pgvector_config table={} dimensions={} initSchema={}", table, dimensions, initializeSchema);
        return new PgVectorStoreAdapter(jdbcTemplate, objectMapper, table, dimensions, initializeSchema);
    }

    @Bean(initMethod = "open", destroyMethod = "close")
    @ConditionalOnProperty(name = "contextrag.vector-store.backend", havingValue = "memory")
    public VectorStoreAdapter inMemoryVectorStore() {
        log.info("event=vector_store_config backend={}", InMemoryVectorStore.BACKEND);
        return new InMemoryVectorStore();
    }
}
