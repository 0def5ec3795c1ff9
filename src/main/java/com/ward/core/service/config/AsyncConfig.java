package com.ward.core.service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread configuration for background work outside the ingestion worker.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    // ==================== Scheduler Beans ====================

    /**
     * Scheduler for debounced session publishing.
     * A single thread keeps snapshots and subscriber callbacks in order.
     */
    @Bean(name = "publishScheduler")
    public ThreadPoolTaskScheduler publishScheduler() {
        log.info("Initializing publish scheduler");
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("session-publish-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
