package com.ward.core.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Ward Core Service - Entry point for the Spring Boot application.
 *
 * Correlates client and server spans of a web application into page sessions and
 * detects performance issues in them:
 * - Receives spans and navigation events over HTTP
 * - Rebuilds affected page sessions on a single ingestion worker
 * - Streams debounced session snapshots with their detected issues
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.ward.core.service.config")
public class WardCoreServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(WardCoreServiceApplication.class, args);
    }
}
