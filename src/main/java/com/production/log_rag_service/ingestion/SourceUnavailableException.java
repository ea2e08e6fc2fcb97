package com.production.log_rag_service.ingestion;

/**
 * A source could not enumerate its documents (missing directory, log backend down).
 */
public class SourceUnavailableException extends IngestionException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
