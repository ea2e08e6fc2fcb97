package com.production.log_rag_service.ingestion;

import com.production.log_rag_service.service.SyncJobService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-runs ingestion periodically. Ticks that find a pass in progress are skipped.
 */
@Component
@ConditionalOnProperty(prefix = "ingestion.schedule", name = "enabled", havingValue = "true")
@Slf4j
public class ScheduledIngestion {

    private final SyncJobService syncJobService;

    public ScheduledIngestion(SyncJobService syncJobService) {
        this.syncJobService = syncJobService;
    }

    @Scheduled(initialDelayString = "${ingestion.schedule.interval:PT15M}",
            fixedDelayString = "${ingestion.schedule.interval:PT15M}")
    public void run() {
        syncJobService.runNow("schedule")
                .ifPresent(status -> log.debug("Scheduled pass {} finished with status {}",
                        status.getJobId(), status.getStatus()));
    }
}
