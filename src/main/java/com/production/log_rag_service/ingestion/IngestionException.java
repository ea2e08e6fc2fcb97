package com.production.log_rag_service.ingestion;

/**
 * Base type for failures raised while diffing or materializing a source.
 * Always scoped to one source or one document; never fatal to a pass.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
