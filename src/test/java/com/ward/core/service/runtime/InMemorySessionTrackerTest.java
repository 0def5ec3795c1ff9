package com.ward.core.service.runtime;

import com.ward.core.service.config.MetricsConfig;
import com.ward.core.service.config.RetentionConfig;
import com.ward.core.session.PageSession;
import com.ward.core.session.SessionBuilder;
import com.ward.core.session.SessionIdPolicy;
import com.ward.core.session.SessionProcessor;
import com.ward.core.span.NavigationEvent;
import com.ward.core.span.NavigationTiming;
import com.ward.core.span.NavigationType;
import com.ward.core.span.RawSpan;
import com.ward.core.span.SpanAttributes;
import com.ward.core.span.SpanOrigin;
import com.ward.core.span.SpanStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySessionTrackerTest {

    private InMemorySessionTracker tracker;
    private MetricsConfig metricsConfig;

    @BeforeEach
    void setUp() {
        RetentionConfig retentionConfig = new RetentionConfig();
        retentionConfig.getSession().setMaxCount(2);
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        tracker = new InMemorySessionTracker(
                new SessionProcessor(new SessionBuilder(), SessionIdPolicy.defaults()),
                metricsConfig,
                retentionConfig);
    }

    private static RawSpan span(String id, String parentId, String sessionId, double start, double end) {
        return RawSpan.builder()
                .id(id)
                .parentId(parentId)
                .traceId("trace-" + id)
                .name("GET /products")
                .origin(SpanOrigin.SERVER)
                .startTime(start)
                .endTime(end)
                .duration(end - start)
                .sessionId(sessionId)
                .projectId("shop")
                .build();
    }

    @Test
    @DisplayName("Spans arriving child-first are correlated once the parent arrives")
    void correlatesAcrossBatches() {
        assertThat(tracker.ingestSpans(List.of(span("child", "root", null, 10, 20)))).isEmpty();
        assertThat(tracker.getOrphanCount()).isEqualTo(1);

        assertThat(tracker.ingestSpans(List.of(span("root", null, "nav_1", 0, 50)))).containsExactly("nav_1");

        PageSession session = tracker.getSession("nav_1").orElseThrow();
        assertThat(session.resources()).hasSize(2);
        assertThat(tracker.getOrphanCount()).isZero();
        assertThat(tracker.getSpanCount()).isEqualTo(2);
        assertThat(metricsConfig.getSessionRebuilds().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A navigation event creates a session and later spans fill it")
    void navigationEventFirst() {
        tracker.ingestNavigationEvent(NavigationEvent.builder()
                .sessionId("nav_2")
                .projectId("shop")
                .route("/checkout")
                .navigationType(NavigationType.NAVIGATION)
                .timing(NavigationTiming.startingAt(100))
                .build());

        assertThat(tracker.getSession("nav_2").orElseThrow().resources()).isEmpty();

        tracker.ingestSpans(List.of(span("s", null, "nav_2", 100, 180)));

        PageSession session = tracker.getSession("nav_2").orElseThrow();
        assertThat(session.resources()).hasSize(1);
        assertThat(session.route()).isEqualTo("/checkout");
        assertThat(tracker.getSessionsByRoute("/checkout")).hasSize(1);
        assertThat(tracker.getSessionsByProject("other")).isEmpty();
    }

    @Test
    @DisplayName("Only the newest sessions are retained")
    void retentionLimit() {
        tracker.ingestSpans(List.of(span("a", null, "nav_a", 0, 10)));
        tracker.ingestSpans(List.of(span("b", null, "nav_b", 100, 110)));
        tracker.ingestSpans(List.of(span("c", null, "nav_c", 200, 210)));

        assertThat(tracker.getSessions()).extracting(PageSession::id).containsExactly("nav_c", "nav_b");
        assertThat(tracker.getSpanCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Errors and slow resources are collected across sessions")
    void resourceQueries() {
        RawSpan failed = span("f", null, "nav_1", 0, 900).toBuilder()
                .status(SpanStatus.ERROR)
                .attributes(Map.of(SpanAttributes.HTTP_RESPONSE_STATUS_CODE, 500))
                .build();
        tracker.ingestSpans(List.of(failed, span("ok", "f", null, 10, 20)));

        assertThat(tracker.getErrors()).extracting(resource -> resource.id()).containsExactly("f");
        assertThat(tracker.getSlowResources(500)).extracting(resource -> resource.id()).containsExactly("f");
    }

    @Test
    @DisplayName("clear discards everything")
    void clear() {
        tracker.ingestSpans(List.of(span("a", null, "nav_a", 0, 10)));

        tracker.clear();

        assertThat(tracker.getSessionCount()).isZero();
        assertThat(tracker.getSpanCount()).isZero();
        assertThat(tracker.getSessions()).isEmpty();
    }

    @Test
    @DisplayName("Work accepted before a clear is not applied to the new recording")
    void dropsWorkFromClearedRecording() {
        long before = tracker.getGeneration();
        tracker.clear();
        NavigationEvent event = NavigationEvent.builder()
                .sessionId("nav_old")
                .projectId("shop")
                .url("http://localhost:3000/old")
                .route("/old")
                .navigationType(NavigationType.INITIAL)
                .timing(NavigationTiming.startingAt(0))
                .build();

        assertThat(tracker.getGeneration()).isEqualTo(before + 1);
        assertThat(tracker.ingestSpans(List.of(span("old", null, "nav_old", 0, 10)), before)).isEmpty();
        assertThat(tracker.ingestNavigationEvent(event, before)).isFalse();
        assertThat(tracker.getSpanCount()).isZero();
        assertThat(tracker.getSessionCount()).isZero();

        assertThat(tracker.ingestSpans(List.of(span("new", null, "nav_new", 0, 10)), tracker.getGeneration()))
                .hasValueSatisfying(rebuilt -> assertThat(rebuilt).containsExactly("nav_new"));
        assertThat(tracker.ingestNavigationEvent(event, tracker.getGeneration())).isTrue();
        assertThat(tracker.getSessionCount()).isEqualTo(2);
    }
}
