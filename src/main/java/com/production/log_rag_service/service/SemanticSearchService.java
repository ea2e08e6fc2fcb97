package com.production.log_rag_service.service;

import com.production.log_rag_service.ingestion.EmbeddingGateway;
import com.production.log_rag_service.lucene.LuceneSearchService;
import com.production.log_rag_service.model.SearchResponse;
import com.production.log_rag_service.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Embeds a free-text query with the same model used for ingestion and returns
 * the nearest chunks.
 */
@Service
@Slf4j
public class SemanticSearchService {

    private final EmbeddingGateway embeddingGateway;
    private final LuceneSearchService luceneSearchService;

    public SemanticSearchService(EmbeddingGateway embeddingGateway, LuceneSearchService luceneSearchService) {
        this.embeddingGateway = embeddingGateway;
        this.luceneSearchService = luceneSearchService;
    }

    public SearchResponse search(String query, int topK) throws IOException {
        return search(query, null, topK);
    }

    /**
     * @param documentId restricts hits to one document when not blank
     */
    public SearchResponse search(String query, String documentId, int topK) throws IOException {
        long start = System.currentTimeMillis();
        float[] queryVector = embeddingGateway.embed(query);

        List<SearchResult> results = documentId == null || documentId.isBlank()
                ? luceneSearchService.search(queryVector, topK)
                : luceneSearchService.searchByDocumentId(queryVector, documentId, topK);

        long searchTimeMs = System.currentTimeMillis() - start;
        log.info("Search '{}' returned {} results in {}ms", query, results.size(), searchTimeMs);

        return SearchResponse.builder()
                .query(query)
                .totalHits(results.size())
                .searchTimeMs(searchTimeMs)
                .results(results)
                .build();
    }
}
