package com.production.log_rag_service.ingestion;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only view of the ledger rows belonging to one source.
 */
public interface LedgerView {

    String sourceId();

    Optional<SourceDocument> find(String documentId);

    Collection<SourceDocument> documents();

    default boolean contains(String documentId) {
        return find(documentId).isPresent();
    }

    /**
     * True when the ledger has no row for the document or records a different version.
     */
    default boolean isNewOrModified(String documentId, String version) {
        return find(documentId)
                .map(existing -> !existing.version().equals(version))
                .orElse(true);
    }
}
