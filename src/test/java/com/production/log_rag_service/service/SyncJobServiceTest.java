package com.production.log_rag_service.service;

import com.production.log_rag_service.ingestion.ContentSource;
import com.production.log_rag_service.ingestion.IngestionOrchestrator;
import com.production.log_rag_service.ingestion.IngestionReport;
import com.production.log_rag_service.ingestion.SourceRegistry;
import com.production.log_rag_service.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SyncJobServiceTest {

    private IngestionOrchestrator orchestrator;
    private SourceRegistry registry;
    private ContentSource pdfs;
    private ContentSource logs;

    @BeforeEach
    void setUp() {
        orchestrator = mock(IngestionOrchestrator.class);
        registry = mock(SourceRegistry.class);
        pdfs = mock(ContentSource.class);
        logs = mock(ContentSource.class);
        when(registry.sources()).thenReturn(List.of(pdfs, logs));
        when(orchestrator.ingest(pdfs)).thenReturn(report("pdf", 2, 0, 7));
        when(orchestrator.ingest(logs)).thenReturn(report("logs", 1, 1, 3));
    }

    @Test
    void jobAggregatesReportsOfEverySource() {
        SyncJobService service = new SyncJobService(orchestrator, registry, Runnable::run);

        String jobId = service.startJob("api");

        JobStatus status = service.getJobStatus(jobId);
        assertThat(status.getStatus()).isEqualTo("COMPLETED");
        assertThat(status.getTrigger()).isEqualTo("api");
        assertThat(status.getSourcesProcessed()).isEqualTo(2);
        assertThat(status.getDocumentsAdded()).isEqualTo(3);
        assertThat(status.getDocumentsUpdated()).isEqualTo(1);
        assertThat(status.getChunksWritten()).isEqualTo(10);
        assertThat(status.getEndTime()).isNotNull();
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void secondPassIsRejectedWhileOneIsRunning() {
        List<Runnable> queued = new ArrayList<>();
        SyncJobService service = new SyncJobService(orchestrator, registry, queued::add);

        String first = service.startJob("api");

        assertThat(service.isRunning()).isTrue();
        assertThatThrownBy(() -> service.startJob("api")).isInstanceOf(IllegalStateException.class);
        assertThat(service.runNow("schedule")).isEmpty();

        queued.get(0).run();
        assertThat(service.getJobStatus(first).getStatus()).isEqualTo("COMPLETED");
        assertThat(service.runNow("schedule")).isPresent();
    }

    @Test
    void storageFailureFailsTheJobAndReleasesTheLock() {
        when(orchestrator.ingest(any())).thenThrow(new DataAccessResourceFailureException("ledger offline"));
        SyncJobService service = new SyncJobService(orchestrator, registry, Runnable::run);

        Optional<JobStatus> status = service.runNow("startup");

        assertThat(status).hasValueSatisfying(job -> {
            assertThat(job.getStatus()).isEqualTo("FAILED");
            assertThat(job.getErrorMessage()).contains("ledger offline");
        });
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void unknownJobIsNull() {
        SyncJobService service = new SyncJobService(orchestrator, registry, Runnable::run);

        assertThat(service.getJobStatus("sync_missing")).isNull();
    }

    private static IngestionReport report(String sourceId, int added, int updated, int chunks) {
        return new IngestionReport(sourceId, added, updated, 0, 0, chunks, 5L, false, null);
    }
}
