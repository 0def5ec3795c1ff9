package com.ward.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the bounded queue between the ingest endpoints and the session worker.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ward.ingest")
public class IngestionConfig {

    private Queue queue = new Queue();

    private Timeout timeout = new Timeout();

    @Getter
    @Setter
    public static class Queue {

        /** Work items held before producers block and then get a 429. */
        private int capacity = 10000;

        /** Utilization percentage at which the pipeline reports itself down. */
        private int backpressureThreshold = 80;

        public boolean isBackpressured(int utilizationPercent) {
            return utilizationPercent >= backpressureThreshold;
        }
    }

    @Getter
    @Setter
    public static class Timeout {

        /** How long an ingest request waits for queue space. */
        private long enqueueMs = 5000;

        /** Worker poll interval; bounds how quickly shutdown is noticed. */
        private long pollMs = 100;
    }
}
