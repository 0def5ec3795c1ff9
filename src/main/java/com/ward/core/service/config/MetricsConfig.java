package com.ward.core.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Meters shared by the ingestion pipeline, the session tracker, detection and the stream.
 * Gauges are registered by their owners through {@link #registerGauge}.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter spansIngested;
    private final Counter navigationEventsIngested;
    private final Counter skippedItems;
    private final Counter sessionRebuilds;
    private final Counter updatesPublished;

    // Timers
    private final Timer rebuildTimer;
    private final Timer detectionTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.spansIngested = Counter.builder("ward.ingest.spans.count")
                .description("Number of spans ingested")
                .register(registry);

        this.navigationEventsIngested = Counter.builder("ward.ingest.navigation.count")
                .description("Number of navigation events ingested")
                .register(registry);

        this.skippedItems = Counter.builder("ward.ingest.skipped.count")
                .description("Number of malformed spans or events skipped")
                .register(registry);

        this.sessionRebuilds = Counter.builder("ward.session.rebuild.count")
                .description("Number of page sessions rebuilt")
                .register(registry);

        this.updatesPublished = Counter.builder("ward.publish.count")
                .description("Number of session updates published to subscribers")
                .register(registry);

        this.rebuildTimer = Timer.builder("ward.session.rebuild.duration")
                .description("Time taken to correlate spans and rebuild sessions")
                .register(registry);

        this.detectionTimer = Timer.builder("ward.issue.detection.duration")
                .description("Time taken to run issue detectors on a session")
                .register(registry);
    }

    /**
     * Registers a gauge sampled from the supplier on every scrape.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(name, valueSupplier)
                .description(description)
                .register(registry);
    }
}
