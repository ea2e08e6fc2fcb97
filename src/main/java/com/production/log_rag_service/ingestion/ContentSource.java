package com.production.log_rag_service.ingestion;

import com.production.log_rag_service.model.IndexChunk;

import java.io.IOException;
import java.util.List;

/**
 * A pluggable origin of indexable documents.
 *
 * <p>Implementations compare what they currently hold against the ledger view
 * they are given, but never write to the ledger or the index themselves.
 */
public interface ContentSource {

    /**
     * Stable identity of this source instance, including the configuration
     * that tells two instances of the same kind apart.
     */
    String identify();

    /**
     * Documents that are absent from the ledger or carry a different version.
     */
    List<SourceDocument> diff(LedgerView existing) throws IOException;

    /**
     * Ledger documents that this source no longer holds. Sources that cannot
     * observe deletion return an empty list.
     */
    List<SourceDocument> findDeleted(LedgerView existing) throws IOException;

    /**
     * Reads the document, splits it into chunks and embeds each chunk.
     *
     * @throws MalformedContentException if the content cannot be decoded
     * @throws EmbeddingException if any chunk fails to embed
     */
    List<IndexChunk> materialize(EmbeddingGateway embeddingGateway, String documentId) throws IOException;
}
