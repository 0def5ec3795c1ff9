package com.ward.core.service.ingest;

import com.ward.core.service.config.IngestionConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker service that processes items from the ingestion queue.
 *
 * Runs a single thread so that session state has exactly one writer and items are
 * applied in arrival order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionWorker {

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final IngestionQueue queue;
    private final IngestionHandler<IngestionWorkItem.SpanBatchWorkItem> spanBatchHandler;
    private final IngestionHandler<IngestionWorkItem.NavigationEventWorkItem> navigationEventHandler;
    private final IngestionConfig ingestionConfig;

    private ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processedItems = new AtomicLong();
    private final AtomicLong failedItems = new AtomicLong();

    // ==================== Lifecycle ====================

    @PostConstruct
    void start() {
        executorService = Executors.newSingleThreadExecutor(this::createWorkerThread);
        running.set(true);
        executorService.submit(this::processLoop);
        log.info("IngestionWorker started");
    }

    @PreDestroy
    void stop() {
        running.set(false);
        shutdownExecutor();
        log.info("IngestionWorker stopped. Processed: {}, failed: {}", processedItems.get(), failedItems.get());
    }

    private Thread createWorkerThread(Runnable runnable) {
        var thread = new Thread(runnable);
        thread.setName("ingestion-worker-" + thread.getId());
        thread.setDaemon(true);
        return thread;
    }

    private void shutdownExecutor() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Forcing shutdown of ingestion worker");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
    }

    // ==================== Processing Loop ====================

    private void processLoop() {
        var pollTimeoutMs = ingestionConfig.getTimeout().getPollMs();
        while (running.get()) {
            processNextItem(pollTimeoutMs);
        }
    }

    private void processNextItem(long pollTimeoutMs) {
        try {
            queue.dequeue(pollTimeoutMs)
                    .ifPresent(this::processWorkItem);
        } catch (Exception e) {
            log.error("Error in ingestion worker loop", e);
        }
    }

    // ==================== Work Item Dispatch ====================

    private void processWorkItem(IngestionWorkItem item) {
        if (log.isDebugEnabled()) {
            log.debug("Processing {} after {}ms in queue",
                    item.entityId(), Duration.between(item.createdAt(), Instant.now()).toMillis());
        }
        try {
            dispatchToHandler(item);
            processedItems.incrementAndGet();
        } catch (IngestionException e) {
            failedItems.incrementAndGet();
            log.error("Ingestion failed for {}: {} [{}]", item.entityId(), e.getMessage(), e.getErrorCode(), e);
        } catch (Exception e) {
            failedItems.incrementAndGet();
            log.error("Unexpected error processing work item: {}", item.entityId(), e);
        }
    }

    private void dispatchToHandler(IngestionWorkItem item) {
        if (item instanceof IngestionWorkItem.SpanBatchWorkItem spanBatch) {
            spanBatchHandler.handle(spanBatch);
        } else if (item instanceof IngestionWorkItem.NavigationEventWorkItem navigationEvent) {
            navigationEventHandler.handle(navigationEvent);
        }
    }

    // ==================== Monitoring ====================

    public boolean isRunning() {
        return running.get();
    }

    public long getProcessedItemCount() {
        return processedItems.get();
    }

    public long getFailedItemCount() {
        return failedItems.get();
    }
}
