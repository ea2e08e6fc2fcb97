package com.production.log_rag_service.ingestion;

/**
 * The embedding model rejected, timed out or returned an unusable vector.
 */
public class EmbeddingException extends IngestionException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
