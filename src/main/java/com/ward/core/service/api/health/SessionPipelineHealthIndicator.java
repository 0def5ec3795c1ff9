package com.ward.core.service.api.health;

import com.ward.core.service.config.IngestionConfig;
import com.ward.core.service.ingest.IngestionQueue;
import com.ward.core.service.ingest.IngestionWorker;
import com.ward.core.service.runtime.SessionTracker;
import com.ward.core.service.stream.SessionUpdatePublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports on the path from ingest to published session updates.
 *
 * Down when the worker has stopped or the queue is past the backpressure threshold.
 */
@Component
@RequiredArgsConstructor
public class SessionPipelineHealthIndicator implements HealthIndicator {

    private final IngestionQueue queue;
    private final IngestionWorker worker;
    private final SessionTracker sessionTracker;
    private final SessionUpdatePublisher publisher;
    private final IngestionConfig config;

    @Override
    public Health health() {
        int utilization = queue.getUtilizationPercent();
        boolean backpressure = config.getQueue().isBackpressured(utilization);

        Health.Builder builder = worker.isRunning() && !backpressure ? Health.up() : Health.down();
        if (backpressure) {
            builder.withDetail("reason", "queue utilization " + utilization + "% >= "
                    + config.getQueue().getBackpressureThreshold() + "%");
        } else if (!worker.isRunning()) {
            builder.withDetail("reason", "ingestion worker stopped");
        }

        return builder
                .withDetail("pendingItems", queue.size())
                .withDetail("pendingSpans", queue.getPendingSpanCount())
                .withDetail("utilizationPercent", utilization)
                .withDetail("workerRunning", worker.isRunning())
                .withDetail("processedItems", worker.getProcessedItemCount())
                .withDetail("failedItems", worker.getFailedItemCount())
                .withDetail("sessions", sessionTracker.getSessionCount())
                .withDetail("spans", sessionTracker.getSpanCount())
                .withDetail("orphanSpans", sessionTracker.getOrphanCount())
                .withDetail("streamSubscribers", publisher.getSubscriberCount())
                .build();
    }
}
