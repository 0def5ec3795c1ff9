package com.ward.core.service.config;

import com.ward.core.issue.IssueDetectionEngine;
import com.ward.core.issue.IssueDetector;
import com.ward.core.issue.detector.Detectors;
import com.ward.core.session.SessionBuilder;
import com.ward.core.session.SessionIdPolicy;
import com.ward.core.session.SessionProcessor;
import com.ward.core.span.SpanNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.util.List;

/**
 * Configuration for the session engine library.
 *
 * Creates the span, session and issue components as Spring beans for injection
 * into the ingestion handlers and the session tracker.
 */
@Slf4j
@Configuration
public class SessionEngineConfig {

    /**
     * Span normalizer.
     * Validates incoming spans and fills category and session tags.
     */
    @Bean
    public SpanNormalizer spanNormalizer() {
        log.info("Initializing SpanNormalizer");
        return new SpanNormalizer();
    }

    /**
     * Session builder.
     * Turns the spans of one session into a resource tree with timing and stats.
     */
    @Bean
    public SessionBuilder sessionBuilder() {
        log.info("Initializing SessionBuilder");
        return new SessionBuilder();
    }

    /**
     * Session id policy.
     * Only ids with a configured prefix become page sessions.
     */
    @Bean
    public SessionIdPolicy sessionIdPolicy(WardConfig wardConfig) {
        List<String> prefixes = wardConfig.getSession().getValidIdPrefixes();
        log.info("Initializing SessionIdPolicy (prefixes={})", prefixes.isEmpty() ? "any" : prefixes);
        return new SessionIdPolicy(prefixes);
    }

    /**
     * Session processor.
     * Rebuilds affected sessions after each ingest.
     */
    @Bean
    public SessionProcessor sessionProcessor(SessionBuilder sessionBuilder, SessionIdPolicy sessionIdPolicy) {
        log.info("Initializing SessionProcessor");
        return new SessionProcessor(sessionBuilder, sessionIdPolicy);
    }

    /**
     * Issue detection engine.
     */
    @Bean
    public IssueDetectionEngine issueDetectionEngine() {
        log.info("Initializing IssueDetectionEngine");
        return new IssueDetectionEngine();
    }

    // ==================== Issue Detectors ====================
    // Injected as a List in @Order order, which is the order detectors run in.

    @Bean
    @Order(1)
    public IssueDetector parentChildWaterfallDetector() {
        return Detectors.PARENT_CHILD_WATERFALL;
    }

    @Bean
    @Order(2)
    public IssueDetector sequentialAwaitsDetector() {
        return Detectors.SEQUENTIAL_AWAITS;
    }

    @Bean
    @Order(3)
    public IssueDetector nPlusOneDetector() {
        return Detectors.N_PLUS_ONE;
    }

    @Bean
    @Order(4)
    public IssueDetector uncachedFetchDetector() {
        return Detectors.UNCACHED_FETCH;
    }
}
