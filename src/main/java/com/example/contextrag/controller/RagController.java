package com.example.contextrag.controller;

import com.example.contextrag.application.service.RagApplicationService;
import com.example.contextrag.controller.exception.BusinessException;
import com.example.contextrag.domain.dto.QueryRequest;
import com.example.contextrag.domain.dto.QueryResponse;
import com.example.contextrag.domain.dto.ResponseData;
import com.example.contextrag.domain.dto.StatsResponse;
import com.example.contextrag.infrastructure.ingest.IngestReport;
import com.example.contextrag.infrastructure.ingest.IngestService;
import com.example.contextrag.infrastructure.ingest.IngestSource;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/rag")
public class RagController {

    private static final Logger log = LoggerFactory.getLogger(RagController.class);

    private final RagApplicationService ragApplicationService;
    private final IngestService ingestService;

    public RagController(RagApplicationService ragApplicationService, IngestService ingestService) {
        this.ragApplicationService = ragApplicationService;
        this.ingestService = ingestService;
    }

    @PostMapping(
            path = "/query",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        return ResponseEntity.ok(ragApplicationService.ask(request));
    }

    /**
     * All files form one run, in the order given. Duplicate ids across files keep their first
     * position; the newest revision supplies the content.
     */
    @PostMapping(
            path = "/ingest",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<ResponseData<IngestReport>> ingest(
            @RequestPart("files") List<MultipartFile> files,
            @RequestParam(value = "sourceType", required = false) String sourceType
    ) {
        if (files == null || files.isEmpty()) {
            throw new BusinessException(HttpStatus.BAD_REQUEST, "at least one file is required");
        }
        List<IngestSource> sources = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            if (file.isEmpty()) {
                throw new BusinessException(HttpStatus.BAD_REQUEST, "file " + file.getOriginalFilename() + " is empty");
            }
            String name = StringUtils.hasText(file.getOriginalFilename()) ? file.getOriginalFilename() : file.getName();
            sources.add(new IngestSource(name, StringUtils.hasText(sourceType) ? sourceType.trim() : null, file::getInputStream));
        }
        log.info("event=api_ingest files={} sourceType={}", files.size(), sourceType);

        IngestReport report = ingestService.ingest(sources);
        HttpStatus status = report.isOk() ? HttpStatus.CREATED : HttpStatus.SERVICE_UNAVAILABLE;

        ResponseData<IngestReport> response = ResponseData.<IngestReport>builder()
                .status(status.value())
                .message(report.isOk() ? "Ingestion completed" : "Ingestion aborted: " + report.message())
                .data(report)
                .build();

        return ResponseEntity.status(status).body(response);
    }

    @GetMapping(path = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<StatsResponse>> stats() {
        ResponseData<StatsResponse> response = ResponseData.<StatsResponse>builder()
                .status(HttpStatus.OK.value())
                .message("Vector store statistics")
                .data(ragApplicationService.stats())
                .build();
        return ResponseEntity.ok(response);
    }
}
