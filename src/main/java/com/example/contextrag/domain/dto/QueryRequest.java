package com.example.contextrag.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    @NotBlank(message = "question is required")
    @Size(max = 2000, message = "question must be at most 2000 characters")
    private String question;

    /**
     * Answers to earlier clarification questions, keyed by field name.
     */
    @JsonProperty("prior_answers")
    private Map<String, String> priorAnswers;

    /**
     * Restricts retrieval to one source, e.g. {@code reddit}.
     */
    private String source;
}
