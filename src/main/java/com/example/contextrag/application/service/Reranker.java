package com.example.contextrag.application.service;

import com.example.contextrag.domain.model.RetrievedChunk;
import com.example.contextrag.infrastructure.vector.VectorMatch;
import java.util.List;

/**
 * Refines nearest-neighbour candidates with a relevance score independent of vector distance.
 */
public interface Reranker {

    /**
     * @return the candidates with rerank scores in [0,1], best first
     */
    List<RetrievedChunk> rerank(String query, List<VectorMatch> candidates);
}
