package com.production.log_rag_service.ingestion;

/**
 * Outcome of one pass over one source.
 */
public record IngestionReport(
        String sourceId,
        int added,
        int updated,
        int deleted,
        int failed,
        int chunksWritten,
        long durationMs,
        boolean aborted,
        String errorMessage
) {

    public int documentsChanged() {
        return added + updated + deleted;
    }
}
