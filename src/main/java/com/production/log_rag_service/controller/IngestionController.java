package com.production.log_rag_service.controller;

import com.production.log_rag_service.ingestion.ContentSource;
import com.production.log_rag_service.ingestion.IngestionLedger;
import com.production.log_rag_service.ingestion.SourceRegistry;
import com.production.log_rag_service.lucene.LuceneIndexService;
import com.production.log_rag_service.model.IngestedDocument;
import com.production.log_rag_service.model.IngestionResponse;
import com.production.log_rag_service.model.IngestionStatus;
import com.production.log_rag_service.model.JobStatus;
import com.production.log_rag_service.service.SyncJobService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Triggers ingestion passes and exposes what the ledger and index hold.
 * Passes run in the background; poll /status/{jobId} for progress.
 */
@RestController
@RequestMapping("/api/v1/ingest")
@Slf4j
public class IngestionController {

    private final SyncJobService syncJobService;
    private final SourceRegistry sourceRegistry;
    private final IngestionLedger ledger;
    private final LuceneIndexService indexService;

    public IngestionController(SyncJobService syncJobService,
                               SourceRegistry sourceRegistry,
                               IngestionLedger ledger,
                               LuceneIndexService indexService) {
        this.syncJobService = syncJobService;
        this.sourceRegistry = sourceRegistry;
        this.ledger = ledger;
        this.indexService = indexService;
    }

    @PostMapping("/sync")
    public ResponseEntity<IngestionResponse> sync() {
        log.info("Sync request for {} sources", sourceRegistry.sources().size());

        String jobId;
        try {
            jobId = syncJobService.startJob("api");
        } catch (IllegalStateException e) {
            return ResponseEntity.status(409)
                    .body(IngestionResponse.builder()
                            .status(IngestionStatus.FAILED)
                            .message(e.getMessage())
                            .build());
        }

        return ResponseEntity.accepted()
                .body(IngestionResponse.builder()
                        .jobId(jobId)
                        .status(IngestionStatus.PROCESSING)
                        .message("Ingestion pass started over " + sourceRegistry.sources().size() + " source(s)")
                        .build());
    }

    /**
     * Poll job progress by jobId.
     */
    @GetMapping("/status/{jobId}")
    public ResponseEntity<?> getJobStatus(@PathVariable String jobId) {
        JobStatus status = syncJobService.getJobStatus(jobId);

        if (status == null) {
            return ResponseEntity.status(404).body(Map.of(
                    "error", "Job not found",
                    "jobId", jobId
            ));
        }

        return ResponseEntity.ok(status);
    }

    @GetMapping("/documents")
    public ResponseEntity<List<IngestedDocument>> listDocuments(
            @RequestParam(value = "sourceId", required = false) String sourceId) {
        return ResponseEntity.ok(ledger.listDocuments(sourceId));
    }

    @GetMapping("/stats")
    public ResponseEntity<?> getStats() {
        try {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("sources", sourceRegistry.sources().stream().map(ContentSource::identify).toList());
            stats.put("ledgerDocuments", ledger.documentCount());
            stats.put("ledgerRecords", ledger.recordCount());
            stats.put("indexChunks", indexService.getChunkCount());
            stats.put("syncRunning", syncJobService.isRunning());
            return ResponseEntity.ok(stats);
        } catch (IOException e) {
            log.error("Failed to read index statistics", e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Failed to read index statistics: " + e.getMessage()
            ));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "log-rag-service"
        ));
    }
}
