package com.production.log_rag_service.ingestion;

import com.production.log_rag_service.config.IngestionConfig;
import com.production.log_rag_service.service.SyncJobService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Submits one background ingestion pass when the application starts.
 */
@Component
@Slf4j
public class IngestionStartupRunner implements ApplicationRunner {

    private final IngestionConfig ingestionConfig;
    private final SyncJobService syncJobService;

    public IngestionStartupRunner(IngestionConfig ingestionConfig, SyncJobService syncJobService) {
        this.ingestionConfig = ingestionConfig;
        this.syncJobService = syncJobService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!ingestionConfig.isRunOnStartup()) {
            log.info("Startup ingestion disabled");
            return;
        }
        String jobId = syncJobService.startJob("startup");
        log.info("Startup ingestion submitted as {}", jobId);
    }
}
