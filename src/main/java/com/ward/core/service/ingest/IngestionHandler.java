package com.ward.core.service.ingest;

/**
 * Applies one kind of work item to the session state.
 *
 * Runs on the ingestion worker thread only.
 *
 * @param <T> the work item type
 */
public interface IngestionHandler<T extends IngestionWorkItem> {

    /**
     * @throws IngestionException if the item could not be applied
     */
    void handle(T workItem);
}
