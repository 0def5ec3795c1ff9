package com.ward.core.service.ingest;

import com.ward.core.service.config.MetricsConfig;
import com.ward.core.service.runtime.SessionTracker;
import com.ward.core.service.stream.SessionUpdatePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;

/**
 * Handler for span batch work items.
 *
 * Feeds spans into the SessionTracker, which correlates them and rebuilds the affected
 * sessions, then asks for a debounced publish.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpanBatchHandler implements IngestionHandler<IngestionWorkItem.SpanBatchWorkItem> {

    private final SessionTracker sessionTracker;
    private final SessionUpdatePublisher publisher;
    private final MetricsConfig metricsConfig;

    @Override
    public void handle(IngestionWorkItem.SpanBatchWorkItem workItem) {
        String batchId = workItem.batchId();

        try {
            log.debug("Processing span batch: batchId={}, spanCount={}", batchId, workItem.spans().size());

            Optional<Set<String>> rebuilt = sessionTracker.ingestSpans(workItem.spans(), workItem.generation());
            if (rebuilt.isEmpty()) {
                log.debug("Span batch {} belongs to a cleared recording, discarded", batchId);
                return;
            }
            metricsConfig.getSpansIngested().increment(workItem.spans().size());
            publisher.requestPublish();

            log.debug("Span batch processed: batchId={}, rebuiltSessions={}", batchId, rebuilt.get());

        } catch (Exception e) {
            throw new IngestionException(
                    "Failed to process span batch: " + e.getMessage(),
                    batchId,
                    "SPAN_BATCH_PROCESSING_FAILED",
                    e
            );
        }
    }
}
