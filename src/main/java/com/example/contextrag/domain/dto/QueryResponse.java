package com.example.contextrag.domain.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryResponse {

    private String answer;
    private double confidenceScore;
    private String confidenceTier;
    private String category;
    private boolean needsClarification;
    private boolean incomplete;
    private List<ClarificationQuestionDto> clarificationQuestions;
    private List<String> followUpQuestions;
    private List<String> actionItems;
    private List<String> relatedTopics;
    private List<SourceDto> sources;

    @Getter
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ClarificationQuestionDto {
        private String question;
        private List<String> options;
        private String context;
        private String fieldName;
    }

    @Getter
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class SourceDto {
        private String title;
        private String url;
        private double score;
        private String contentPreview;
        private String source;
    }
}
