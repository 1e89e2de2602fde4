package com.example.contextrag.domain.dto;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class StatsResponse {
    private String backend;
    private long totalRecords;
    private int dimensions;
    private Map<String, Long> recordsBySource;
    private String embeddingModel;
    private int chunkMaxSize;
    private int chunkOverlap;
    private int retrieveCandidates;
    private int retrieveFinal;
}
