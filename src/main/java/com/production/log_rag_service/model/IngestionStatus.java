package com.production.log_rag_service.model;

public enum IngestionStatus {
    PROCESSING,
    SUCCESS,
    FAILED
}
