package com.example.contextrag.infrastructure.ingest;

/**
 * A captured item that cannot be turned into a canonical record. Callers count and drop it.
 */
public class MalformedRecordException extends RuntimeException {

    private final String sourceName;
    private final long lineNumber;

    public MalformedRecordException(String message, String sourceName, long lineNumber) {
        super(message);
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
    }

    public MalformedRecordException(String message, String sourceName, long lineNumber, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
    }

    public String getSourceName() {
        return sourceName;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
