package com.example.contextrag.infrastructure.vector;

/**
 * The backend is reachable but refused the record itself, e.g. a vector of the wrong dimension.
 */
public class VectorRecordRejectedException extends RuntimeException {

    private final String chunkId;

    public VectorRecordRejectedException(String chunkId, String message) {
        super(message);
        this.chunkId = chunkId;
    }

    public VectorRecordRejectedException(String chunkId, String message, Throwable cause) {
        super(message, cause);
        this.chunkId = chunkId;
    }

    /**
     * @return the refused chunk, or {@code null} when the backend refused a whole batch
     */
    public String getChunkId() {
        return chunkId;
    }
}
