package com.production.log_rag_service.ingestion;

/**
 * Detached view of a document: its identity within a source and its version token.
 * Two values with the same id, sourceId and version describe identical content.
 */
public record SourceDocument(String id, String sourceId, String version) {
}
