package com.ward.core.service.ingest;

import java.util.Optional;

/**
 * FIFO buffer between the ingest endpoints and the single ingestion worker.
 */
public interface IngestionQueue {

    /**
     * Offers a work item, waiting up to {@code timeoutMs} for space.
     *
     * @return false when the queue stayed full for the whole timeout
     */
    boolean enqueue(IngestionWorkItem item, long timeoutMs);

    /**
     * Takes the oldest work item, waiting up to {@code timeoutMs} for one to arrive.
     */
    Optional<IngestionWorkItem> dequeue(long timeoutMs);

    int size();

    int getCapacity();

    /**
     * Spans carried by all pending work items.
     */
    int getPendingSpanCount();

    default int getUtilizationPercent() {
        int capacity = getCapacity();
        return capacity > 0 ? (size() * 100) / capacity : 0;
    }

    /**
     * Drops every pending work item, as when a recording is cleared.
     *
     * @return number of items dropped
     */
    int clear();
}
