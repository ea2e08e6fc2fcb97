package com.production.log_rag_service.ingestion;

/**
 * A document's content could not be decoded. The document is skipped for this pass.
 */
public class MalformedContentException extends IngestionException {

    public MalformedContentException(String message) {
        super(message);
    }

    public MalformedContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
