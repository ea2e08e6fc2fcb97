package com.production.log_rag_service.controller;

import com.production.log_rag_service.ingestion.EmbeddingException;
import com.production.log_rag_service.model.SearchResponse;
import com.production.log_rag_service.service.SemanticSearchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/search")
@Slf4j
public class SearchController {

    private final SemanticSearchService searchService;

    public SearchController(SemanticSearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping
    public ResponseEntity<?> search(
            @RequestParam("q") String query,
            @RequestParam(value = "topK", defaultValue = "10") int topK,
            @RequestParam(value = "documentId", required = false) String documentId) {

        log.info("Search request - query: '{}', topK: {}, documentId: {}", query, topK, documentId);
        return execute(query, topK, documentId);
    }

    @PostMapping
    public ResponseEntity<?> searchPost(@RequestBody SearchRequest request) {
        log.info("Search POST request - query: '{}', topK: {}, documentId: {}",
                request.query(), request.topK(), request.documentId());
        return execute(request.query(), request.topK() != null ? request.topK() : 10, request.documentId());
    }

    private ResponseEntity<?> execute(String query, int topK, String documentId) {
        if (query == null || query.trim().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Query parameter 'q' is required"
            ));
        }

        if (topK < 1 || topK > 100) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "topK must be between 1 and 100"
            ));
        }

        try {
            SearchResponse response = searchService.search(query, documentId, topK);
            return ResponseEntity.ok(response);

        } catch (EmbeddingException e) {
            log.error("Query embedding failed: {}", e.getMessage());
            return ResponseEntity.status(503).body(Map.of(
                    "error", "Embedding model unavailable: " + e.getMessage()
            ));
        } catch (IOException e) {
            log.error("Search failed", e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Search failed: " + e.getMessage()
            ));
        }
    }

    public record SearchRequest(String query, Integer topK, String documentId) {}
}
