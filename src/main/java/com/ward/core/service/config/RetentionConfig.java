package com.ward.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for session retention.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ward.retention")
public class RetentionConfig {

    /**
     * Session retention settings.
     */
    private SessionRetention session = new SessionRetention();

    @Getter
    @Setter
    public static class SessionRetention {

        /**
         * Maximum number of page sessions kept in memory; older ones are evicted
         * after each rebuild.
         */
        private int maxCount = 100;
    }
}
