package com.production.log_rag_service.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration for the ingestion pipeline: which sources are registered,
 * when passes run, and how many embedding calls may be in flight at once.
 */
@Component
@ConfigurationProperties(prefix = "ingestion")
@Data
@Slf4j
public class IngestionConfig {

    /**
     * Embedding concurrency: "auto" for auto-detection, or a specific number.
     * Auto mode: threads = max(2, cores - 2)
     */
    private String threads = "auto";

    private boolean runOnStartup = true;

    private Schedule schedule = new Schedule();
    private DirectorySource pdf = new DirectorySource("data/pdf");
    private DirectorySource logs = new DirectorySource("data/logs");
    private Toggle loki = new Toggle();

    /**
     * Resolves the number of concurrent embedding calls to allow.
     */
    public int resolveThreadCount() {
        if ("auto".equalsIgnoreCase(threads)) {
            return autoThreadCount();
        }
        try {
            int threadCount = Integer.parseInt(threads);
            if (threadCount < 1) {
                log.warn("Thread count must be positive, got {}; falling back to auto", threadCount);
                return autoThreadCount();
            }
            log.info("Using embedding threads: {} (configured)", threadCount);
            return threadCount;
        } catch (NumberFormatException e) {
            log.warn("Invalid thread config '{}', falling back to auto", threads);
            return autoThreadCount();
        }
    }

    private int autoThreadCount() {
        int cores = Runtime.getRuntime().availableProcessors();
        int threadCount = Math.max(2, cores - 2);
        log.info("Detected CPU cores: {}", cores);
        log.info("Using embedding threads: {}", threadCount);
        return threadCount;
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(15);
    }

    @Data
    public static class DirectorySource {
        private boolean enabled = true;
        private String directory;

        public DirectorySource() {
        }

        public DirectorySource(String directory) {
            this.directory = directory;
        }
    }

    @Data
    public static class Toggle {
        private boolean enabled = false;
    }
}
