package com.example.contextrag.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.contextrag.application.service.RagApplicationService;
import com.example.contextrag.controller.exception.GlobalExceptionHandler;
import com.example.contextrag.domain.dto.QueryRequest;
import com.example.contextrag.domain.dto.QueryResponse;
import com.example.contextrag.domain.dto.StatsResponse;
import com.example.contextrag.infrastructure.ingest.IngestReport;
import com.example.contextrag.infrastructure.ingest.IngestService;
import com.example.contextrag.infrastructure.ingest.IngestSource;
import com.example.contextrag.infrastructure.vector.VectorStoreUnavailableException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class RagControllerTest {

    private RagApplicationService ragApplicationService;
    private IngestService ingestService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ragApplicationService = mock(RagApplicationService.class);
        ingestService = mock(IngestService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new RagController(ragApplicationService, ingestService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void query_returnsSnakeCaseResponse() throws Exception {
        QueryResponse response = QueryResponse.builder()
                .answer("Try the library.")
                .confidenceScore(0.72)
                .confidenceTier("MEDIUM")
                .category("jobs")
                .needsClarification(true)
                .incomplete(false)
                .clarificationQuestions(List.of(QueryResponse.ClarificationQuestionDto.builder()
                        .question("Are you looking for on-campus or off-campus job opportunities?")
                        .options(List.of("On-campus", "Off-campus"))
                        .fieldName("job_location")
                        .build()))
                .followUpQuestions(List.of())
                .actionItems(List.of("Visit the Career Services office"))
                .relatedTopics(List.of())
                .sources(List.of(QueryResponse.SourceDto.builder()
                        .title("Jobs thread").score(0.8).contentPreview("The library hires...").source("reddit")
                        .build()))
                .build();
        when(ragApplicationService.ask(any(QueryRequest.class))).thenReturn(response);

        mockMvc.perform(post("/api/rag/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"I want a good job\",\"prior_answers\":{\"major\":\"Business\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Try the library."))
                .andExpect(jsonPath("$.confidence_score").value(0.72))
                .andExpect(jsonPath("$.needs_clarification").value(true))
                .andExpect(jsonPath("$.clarification_questions[0].field_name").value("job_location"))
                .andExpect(jsonPath("$.sources[0].content_preview").value("The library hires..."));

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(ragApplicationService).ask(captor.capture());
        assertEquals(Map.of("major", "Business"), captor.getValue().getPriorAnswers());
    }

    @Test
    void query_blankQuestion_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/rag/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("question: question is required"));

        verify(ragApplicationService, never()).ask(any());
    }

    @Test
    void query_malformedBody_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/rag/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void ingest_passesFilesInOrderAndReturnsCreated() throws Exception {
        when(ingestService.ingest(anyList())).thenReturn(IngestReport.builder()
                .status(IngestReport.Status.OK).sources(2).records(3).upserted(3).build());

        mockMvc.perform(multipart("/api/rag/ingest")
                        .file(new MockMultipartFile("files", "a.jsonl", "application/x-ndjson", "{\"id\":\"1\"}\n".getBytes()))
                        .file(new MockMultipartFile("files", "b.jsonl", "application/x-ndjson", "{\"id\":\"2\"}\n".getBytes()))
                        .param("sourceType", "reddit"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value(201))
                .andExpect(jsonPath("$.data.upserted").value(3));

        ArgumentCaptor<List<IngestSource>> captor = ArgumentCaptor.forClass(List.class);
        verify(ingestService).ingest(captor.capture());
        List<IngestSource> sources = captor.getValue();
        assertEquals(2, sources.size());
        assertEquals("a.jsonl", sources.get(0).name());
        assertEquals("b.jsonl", sources.get(1).name());
        assertEquals("reddit", sources.get(0).sourceTypeHint());
    }

    @Test
    void ingest_abortedRun_isServiceUnavailable() throws Exception {
        when(ingestService.ingest(anyList())).thenReturn(IngestReport.builder()
                .status(IngestReport.Status.ABORTED).message("vector store unavailable: down").build());

        mockMvc.perform(multipart("/api/rag/ingest")
                        .file(new MockMultipartFile("files", "a.jsonl", "application/x-ndjson", "{}\n".getBytes())))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Ingestion aborted: vector store unavailable: down"));
    }

    @Test
    void ingest_emptyFile_isBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/rag/ingest")
                        .file(new MockMultipartFile("files", "empty.jsonl", "application/x-ndjson", new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("file empty.jsonl is empty"));

        verify(ingestService, never()).ingest(anyList());
    }

    @Test
    void stats_wrapsStoreStatistics() throws Exception {
        when(ragApplicationService.stats()).thenReturn(StatsResponse.builder()
                .backend("memory").totalRecords(5).dimensions(768)
                .recordsBySource(Map.of("reddit", 5L)).embeddingModel("nomic-embed-text")
                .build());

        mockMvc.perform(get("/api/rag/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.backend").value("memory"))
                .andExpect(jsonPath("$.data.totalRecords").value(5))
                .andExpect(jsonPath("$.data.recordsBySource.reddit").value(5));
    }

    @Test
    void stats_storeDown_isServiceUnavailable() throws Exception {
        when(ragApplicationService.stats()).thenThrow(new VectorStoreUnavailableException("connection refused"));

        mockMvc.perform(get("/api/rag/stats"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503));
    }
}
