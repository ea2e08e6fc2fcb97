package com.production.log_rag_service.ingestion;

import com.production.log_rag_service.config.AppConfig;
import com.production.log_rag_service.config.IngestionConfig;
import com.production.log_rag_service.ingestion.source.JsonLogDirectorySource;
import com.production.log_rag_service.ingestion.source.LokiLogSource;
import com.production.log_rag_service.ingestion.source.PdfDirectorySource;
import com.production.log_rag_service.loki.LokiClient;
import com.production.log_rag_service.service.ChunkingService;
import com.production.log_rag_service.service.TextCleaningService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The configured sources in registration order: PDF directory, JSON log
 * directory, then Loki.
 */
@Component
@Slf4j
public class SourceRegistry {

    private final IngestionConfig ingestionConfig;
    private final AppConfig appConfig;
    private final TextCleaningService textCleaningService;
    private final ChunkingService chunkingService;
    private final LokiClient lokiClient;

    private List<ContentSource> sources = List.of();

    public SourceRegistry(IngestionConfig ingestionConfig,
                          AppConfig appConfig,
                          TextCleaningService textCleaningService,
                          ChunkingService chunkingService,
                          LokiClient lokiClient) {
        this.ingestionConfig = ingestionConfig;
        this.appConfig = appConfig;
        this.textCleaningService = textCleaningService;
        this.chunkingService = chunkingService;
        this.lokiClient = lokiClient;
    }

    @PostConstruct
    public void init() {
        List<ContentSource> registered = new ArrayList<>();

        IngestionConfig.DirectorySource pdf = ingestionConfig.getPdf();
        if (pdf.isEnabled()) {
            registered.add(new PdfDirectorySource(Paths.get(pdf.getDirectory()), textCleaningService, chunkingService));
        }

        IngestionConfig.DirectorySource logs = ingestionConfig.getLogs();
        if (logs.isEnabled()) {
            registered.add(new JsonLogDirectorySource(Paths.get(logs.getDirectory())));
        }

        if (ingestionConfig.getLoki().isEnabled()) {
            AppConfig.Loki loki = appConfig.getLoki();
            registered.add(new LokiLogSource(lokiClient, loki.getQuery(), loki.getLookback(), loki.getLimit(),
                    Clock.systemUTC()));
        }

        this.sources = Collections.unmodifiableList(registered);
        for (ContentSource source : sources) {
            log.info("Registered source {}", source.identify());
        }
    }

    public List<ContentSource> sources() {
        return sources;
    }
}
