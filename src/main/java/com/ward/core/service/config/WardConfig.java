package com.ward.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Overall application configuration for Ward Core Service.
 *
 * Contains toggles, feature flags, session id rules and stream settings.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ward")
public class WardConfig {

    /**
     * Enable or disable ingestion. When disabled, ingest endpoints reject requests.
     */
    private boolean enabled = true;

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    /**
     * Session id rules.
     */
    private SessionConfig session = new SessionConfig();

    /**
     * Session update stream settings.
     */
    private StreamConfig stream = new StreamConfig();

    @Getter
    @Setter
    public static class Features {

        /**
         * Run issue detectors on published sessions.
         */
        private boolean detectionEnabled = true;
    }

    @Getter
    @Setter
    public static class SessionConfig {

        /**
         * Session ids must start with one of these prefixes to become page sessions.
         * An empty list accepts every id.
         */
        private List<String> validIdPrefixes = new ArrayList<>(List.of("nav_", "srv_"));
    }

    @Getter
    @Setter
    public static class StreamConfig {

        /**
         * Quiet period after the last write before a snapshot is published.
         */
        private long debounceMs = 500;

        /**
         * Server-sent event connection timeout in milliseconds (0 = no timeout).
         */
        private long subscriberTimeoutMs = 0;
    }
}
