package com.production.log_rag_service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
@EnableScheduling
@Slf4j
public class AsyncConfig {

    /**
     * Runs sync passes in the background. One worker: passes never overlap.
     */
    @Bean(name = "ingestionExecutor")
    public Executor ingestionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(2);
        executor.setThreadNamePrefix("sync-job-");
        executor.setRejectedExecutionHandler((runnable, pool) ->
                log.warn("Sync job rejected - queue full. Max concurrent: 1, queue: 2"));
        executor.initialize();
        log.info("Initialized ingestion executor: corePool=1, maxPool=1, queue=2");
        return executor;
    }
}
