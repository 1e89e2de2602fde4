package com.example.contextrag.infrastructure.ingest;

import com.example.contextrag.domain.model.RawItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads one JSON object per line. Blank lines are skipped; lines that are not a JSON object are
 * counted and dropped.
 */
@Component
public class JsonLinesReader {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesReader.class);

    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };
    private static final int MAX_LOGGED_ERRORS = 5;

    private final ObjectMapper objectMapper;

    public JsonLinesReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record ReadResult(List<RawItem> items, long linesRead, int unparseable) {
    }

    public ReadResult read(IngestSource source) throws IOException {
        List<RawItem> items = new ArrayList<>();
        long lineNo = 0;
        int bad = 0;

        try (InputStream in = source.opener().open();
             BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    Map<String, Object> fields = objectMapper.readValue(line, OBJECT_TYPE);
                    if (fields == null) {
                        throw new IllegalArgumentException("null JSON value");
                    }
                    items.add(new RawItem(fields, source.sourceTypeHint(), source.name(), lineNo));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    bad++;
                    if (bad <= MAX_LOGGED_ERRORS) {
                        log.warn("event=jsonl_unparseable source={} line={} err={}", source.name(), lineNo, e.getMessage());
                    }
                }
            }
        }

        log.info("event=jsonl_read source={} lines={} items={} unparseable={}", source.name(), lineNo, items.size(), bad);
        return new ReadResult(items, lineNo, bad);
    }
}
