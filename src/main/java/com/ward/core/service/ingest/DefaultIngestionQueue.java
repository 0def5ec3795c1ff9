package com.ward.core.service.ingest;

import com.ward.core.service.config.IngestionConfig;
import com.ward.core.service.config.MetricsConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded ingestion queue backed by a {@link LinkedBlockingQueue}.
 *
 * Capacity counts work items, not spans; the number of spans waiting is tracked separately.
 */
@Slf4j
@Component
public class DefaultIngestionQueue implements IngestionQueue {

    private final BlockingQueue<IngestionWorkItem> queue;
    private final int capacity;
    private final AtomicInteger pendingSpans = new AtomicInteger();

    public DefaultIngestionQueue(IngestionConfig config, MetricsConfig metricsConfig) {
        this.capacity = config.getQueue().getCapacity();
        this.queue = new LinkedBlockingQueue<>(capacity);

        metricsConfig.registerGauge("ward.ingest.queue.size", "Pending ingestion work items", this::size);
        metricsConfig.registerGauge("ward.ingest.queue.spans", "Spans waiting to be correlated",
                this::getPendingSpanCount);

        log.info("Ingestion queue ready, capacity {} items", capacity);
    }

    @Override
    public boolean enqueue(IngestionWorkItem item, long timeoutMs) {
        boolean accepted;
        try {
            accepted = queue.offer(item, timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while enqueuing {}", item.entityId());
            return false;
        }

        if (accepted) {
            pendingSpans.addAndGet(item.spanCount());
            log.trace("Enqueued {} ({} spans)", item.entityId(), item.spanCount());
        }
        return accepted;
    }

    @Override
    public Optional<IngestionWorkItem> dequeue(long timeoutMs) {
        IngestionWorkItem item;
        try {
            item = queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }

        if (item != null) {
            pendingSpans.addAndGet(-item.spanCount());
        }
        return Optional.ofNullable(item);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public int getPendingSpanCount() {
        return pendingSpans.get();
    }

    @Override
    public int clear() {
        List<IngestionWorkItem> dropped = new ArrayList<>();
        queue.drainTo(dropped);
        int spans = dropped.stream().mapToInt(IngestionWorkItem::spanCount).sum();
        pendingSpans.addAndGet(-spans);
        log.info("Dropped {} pending work items ({} spans)", dropped.size(), spans);
        return dropped.size();
    }
}
