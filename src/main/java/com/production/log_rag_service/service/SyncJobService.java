package com.production.log_rag_service.service;

import com.production.log_rag_service.ingestion.ContentSource;
import com.production.log_rag_service.ingestion.IngestionOrchestrator;
import com.production.log_rag_service.ingestion.IngestionReport;
import com.production.log_rag_service.ingestion.SourceRegistry;
import com.production.log_rag_service.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs ingestion passes over all registered sources and tracks them as jobs.
 *
 * At most one pass runs at a time, whatever triggered it (REST, startup or
 * schedule). Status is kept in memory for polling.
 */
@Service
@Slf4j
public class SyncJobService {

    private final ConcurrentHashMap<String, JobStatus> jobs = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final IngestionOrchestrator orchestrator;
    private final SourceRegistry sourceRegistry;
    private final Executor ingestionExecutor;

    public SyncJobService(IngestionOrchestrator orchestrator,
                          SourceRegistry sourceRegistry,
                          @Qualifier("ingestionExecutor") Executor ingestionExecutor) {
        this.orchestrator = orchestrator;
        this.sourceRegistry = sourceRegistry;
        this.ingestionExecutor = ingestionExecutor;
    }

    /**
     * Starts a pass in the background and returns its jobId immediately.
     *
     * @throws IllegalStateException if a pass is already running
     */
    public String startJob(String trigger) {
        JobStatus status = reserve(trigger)
                .orElseThrow(() -> new IllegalStateException("An ingestion pass is already running"));
        ingestionExecutor.execute(() -> runJob(status));
        return status.getJobId();
    }

    /**
     * Runs a pass on the calling thread. Returns empty when another pass is running.
     */
    public Optional<JobStatus> runNow(String trigger) {
        Optional<JobStatus> status = reserve(trigger);
        if (status.isEmpty()) {
            log.info("Skipping {} pass - another pass is still running", trigger);
            return Optional.empty();
        }
        runJob(status.get());
        return status;
    }

    public JobStatus getJobStatus(String jobId) {
        return jobs.get(jobId);
    }

    public boolean isRunning() {
        return running.get();
    }

    private Optional<JobStatus> reserve(String trigger) {
        if (!running.compareAndSet(false, true)) {
            return Optional.empty();
        }
        String jobId = "sync_" + UUID.randomUUID().toString().substring(0, 12);
        JobStatus status = new JobStatus(jobId, trigger, sourceRegistry.sources().size());
        jobs.put(jobId, status);
        log.info("[{}] Job created - trigger={}, {} sources", jobId, trigger, status.getTotalSources());
        return Optional.of(status);
    }

    private void runJob(JobStatus status) {
        String jobId = status.getJobId();
        long jobStartTime = System.currentTimeMillis();
        try {
            List<ContentSource> sources = sourceRegistry.sources();
            for (ContentSource source : sources) {
                IngestionReport report = orchestrator.ingest(source);
                status.addReport(report);
            }
            status.complete();
            log.info("[{}] Job completed - {} added, {} updated, {} deleted, {} failed, {} chunks, {}s",
                    jobId, status.getDocumentsAdded(), status.getDocumentsUpdated(), status.getDocumentsDeleted(),
                    status.getDocumentsFailed(), status.getChunksWritten(),
                    String.format("%.1f", (System.currentTimeMillis() - jobStartTime) / 1000.0));
        } catch (RuntimeException e) {
            // Ledger/storage failure: the pass stops, committed documents stay committed
            log.error("[{}] Job failed: {}", jobId, e.getMessage(), e);
            status.fail(e.getMessage());
        } finally {
            running.set(false);
        }
    }
}
