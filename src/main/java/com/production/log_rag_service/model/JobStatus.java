package com.production.log_rag_service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.production.log_rag_service.ingestion.IngestionReport;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatus {

    private final String jobId;
    private final String trigger;
    private volatile String status;
    private final int totalSources;
    private final List<IngestionReport> reports = new CopyOnWriteArrayList<>();
    private final Instant startTime;
    private volatile Instant endTime;
    private volatile String errorMessage;

    public JobStatus(String jobId, String trigger, int totalSources) {
        this.jobId = jobId;
        this.trigger = trigger;
        this.totalSources = totalSources;
        this.status = "PROCESSING";
        this.startTime = Instant.now();
    }

    public void addReport(IngestionReport report) {
        reports.add(report);
    }

    public void complete() {
        this.status = "COMPLETED";
        this.endTime = Instant.now();
    }

    public void fail(String errorMessage) {
        this.errorMessage = errorMessage;
        this.status = "FAILED";
        this.endTime = Instant.now();
    }

    // Totals across sources (Jackson serialization)
    public int getSourcesProcessed() {
        return reports.size();
    }

    public int getDocumentsAdded() {
        return reports.stream().mapToInt(IngestionReport::added).sum();
    }

    public int getDocumentsUpdated() {
        return reports.stream().mapToInt(IngestionReport::updated).sum();
    }

    public int getDocumentsDeleted() {
        return reports.stream().mapToInt(IngestionReport::deleted).sum();
    }

    public int getDocumentsFailed() {
        return reports.stream().mapToInt(IngestionReport::failed).sum();
    }

    public int getChunksWritten() {
        return reports.stream().mapToInt(IngestionReport::chunksWritten).sum();
    }
}
