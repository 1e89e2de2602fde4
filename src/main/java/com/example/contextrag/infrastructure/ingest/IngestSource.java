package com.example.contextrag.infrastructure.ingest;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A named stream of JSON lines plus the source type assumed for items that do not declare one.
 */
public record IngestSource(String name, String sourceTypeHint, Opener opener) {

    @FunctionalInterface
    public interface Opener {
        InputStream open() throws IOException;
    }

    public IngestSource {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("source name is required");
        }
        if (opener == null) {
            throw new IllegalArgumentException("source opener is required");
        }
    }

    public static IngestSource ofPath(Path path, String sourceTypeHint) {
        return new IngestSource(path.getFileName().toString(), sourceTypeHint, () -> Files.newInputStream(path));
    }

    public static IngestSource ofString(String name, String sourceTypeHint, String jsonLines) {
        byte[] bytes = jsonLines.getBytes(StandardCharsets.UTF_8);
        return new IngestSource(name, sourceTypeHint, () -> new ByteArrayInputStream(bytes));
    }
}
