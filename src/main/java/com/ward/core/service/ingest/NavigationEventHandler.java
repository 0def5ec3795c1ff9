package com.ward.core.service.ingest;

import com.ward.core.service.config.MetricsConfig;
import com.ward.core.service.runtime.SessionTracker;
import com.ward.core.service.stream.SessionUpdatePublisher;
import com.ward.core.span.NavigationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Handler for navigation event work items.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NavigationEventHandler implements IngestionHandler<IngestionWorkItem.NavigationEventWorkItem> {

    private final SessionTracker sessionTracker;
    private final SessionUpdatePublisher publisher;
    private final MetricsConfig metricsConfig;

    @Override
    public void handle(IngestionWorkItem.NavigationEventWorkItem workItem) {
        NavigationEvent event = workItem.event();

        try {
            log.debug("Processing navigation event: sessionId={}, type={}",
                    event.sessionId(), event.navigationType().getValue());

            if (!sessionTracker.ingestNavigationEvent(event, workItem.generation())) {
                log.debug("Navigation event for {} belongs to a cleared recording, discarded", event.sessionId());
                return;
            }
            metricsConfig.getNavigationEventsIngested().increment();
            publisher.requestPublish();

        } catch (Exception e) {
            throw new IngestionException(
                    "Failed to process navigation event: " + e.getMessage(),
                    event.sessionId(),
                    "NAVIGATION_EVENT_PROCESSING_FAILED",
                    e
            );
        }
    }
}
