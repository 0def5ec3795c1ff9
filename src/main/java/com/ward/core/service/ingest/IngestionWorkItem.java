package com.ward.core.service.ingest;

import com.ward.core.span.NavigationEvent;
import com.ward.core.span.RawSpan;

import java.time.Instant;
import java.util.List;

/**
 * Unit of work handed from the ingest endpoints to the ingestion worker.
 *
 * Items are applied in the order they were accepted, so a navigation event posted after
 * a span batch is never applied before it.
 */
public sealed interface IngestionWorkItem permits
        IngestionWorkItem.SpanBatchWorkItem,
        IngestionWorkItem.NavigationEventWorkItem {

    /**
     * Batch id or session id, for logging.
     */
    String entityId();

    Instant createdAt();

    /**
     * Recording generation current when the item was accepted. Items from an earlier
     * generation are dropped by the session tracker.
     */
    long generation();

    /**
     * Number of spans carried by this item.
     */
    int spanCount();

    /**
     * Normalized spans from one ingest request, in request order.
     */
    record SpanBatchWorkItem(
            String batchId,
            List<RawSpan> spans,
            long generation,
            Instant createdAt
    ) implements IngestionWorkItem {

        public SpanBatchWorkItem {
            spans = List.copyOf(spans);
        }

        public SpanBatchWorkItem(String batchId, List<RawSpan> spans, long generation) {
            this(batchId, spans, generation, Instant.now());
        }

        @Override
        public String entityId() {
            return batchId;
        }

        @Override
        public int spanCount() {
            return spans.size();
        }
    }

    record NavigationEventWorkItem(
            NavigationEvent event,
            long generation,
            Instant createdAt
    ) implements IngestionWorkItem {

        public NavigationEventWorkItem(NavigationEvent event, long generation) {
            this(event, generation, Instant.now());
        }

        @Override
        public String entityId() {
            return event.sessionId();
        }

        @Override
        public int spanCount() {
            return 0;
        }
    }
}
