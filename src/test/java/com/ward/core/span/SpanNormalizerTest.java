package com.ward.core.span;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpanNormalizerTest {

    private final SpanNormalizer normalizer = new SpanNormalizer();

    private static RawSpan.RawSpanBuilder draft() {
        return RawSpan.builder()
                .id("span-1")
                .traceId("trace-1")
                .name("GET /api/users")
                .origin(SpanOrigin.SERVER)
                .startTime(100)
                .endTime(150);
    }

    @Test
    @DisplayName("Duration is derived from start and end")
    void computesDuration() {
        RawSpan span = normalizer.normalize(draft().build());

        assertThat(span.duration()).isEqualTo(50.0);
        assertThat(span.status()).isEqualTo(SpanStatus.UNSET);
    }

    @Test
    @DisplayName("End before start is clamped to start")
    void clampsNegativeDuration() {
        RawSpan span = normalizer.normalize(draft().startTime(200).endTime(150).build());

        assertThat(span.endTime()).isEqualTo(200.0);
        assertThat(span.duration()).isZero();
    }

    @Test
    @DisplayName("Session, project and request tags are read from attributes")
    void readsTagsFromAttributes() {
        RawSpan span = normalizer.normalize(draft()
                .attributes(Map.of(
                        SpanAttributes.SESSION_ID, "nav_1",
                        SpanAttributes.PROJECT_ID, "shop",
                        SpanAttributes.REQUEST_ID, "req-9"))
                .build());

        assertThat(span.sessionId()).isEqualTo("nav_1");
        assertThat(span.projectId()).isEqualTo("shop");
        assertThat(span.requestId()).isEqualTo("req-9");
    }

    @Test
    @DisplayName("Explicit tags win over attributes")
    void explicitTagsWin() {
        RawSpan span = normalizer.normalize(draft()
                .sessionId("nav_explicit")
                .attributes(Map.of(SpanAttributes.SESSION_ID, "nav_attr"))
                .build());

        assertThat(span.sessionId()).isEqualTo("nav_explicit");
    }

    @Test
    @DisplayName("Blank parent id becomes null")
    void blankParentIsRoot() {
        RawSpan span = normalizer.normalize(draft().parentId("  ").build());

        assertThat(span.parentId()).isNull();
    }

    @Test
    @DisplayName("Category override attribute is honoured")
    void categoryOverride() {
        RawSpan span = normalizer.normalize(draft()
                .name("something")
                .attributes(Map.of(SpanAttributes.SPAN_CATEGORY, "database"))
                .build());

        assertThat(span.category()).isEqualTo(SpanCategory.DATABASE);
    }

    @Test
    @DisplayName("Category inference follows name and attribute heuristics")
    void infersCategory() {
        assertThat(normalizer.inferCategory("fetch users", Map.of())).isEqualTo(SpanCategory.HTTP);
        assertThat(normalizer.inferCategory("op", Map.of(SpanAttributes.HTTP_METHOD, "GET")))
                .isEqualTo(SpanCategory.HTTP);
        assertThat(normalizer.inferCategory("prisma:findMany", Map.of())).isEqualTo(SpanCategory.DATABASE);
        assertThat(normalizer.inferCategory("unstable_cache", Map.of())).isEqualTo(SpanCategory.CACHE);
        assertThat(normalizer.inferCategory("render route (app) /", Map.of())).isEqualTo(SpanCategory.RENDER);
        assertThat(normalizer.inferCategory("hydrate root", Map.of())).isEqualTo(SpanCategory.HYDRATION);
        assertThat(normalizer.inferCategory("middleware", Map.of())).isEqualTo(SpanCategory.MIDDLEWARE);
        assertThat(normalizer.inferCategory("call", Map.of(SpanAttributes.PEER_SERVICE, "billing")))
                .isEqualTo(SpanCategory.EXTERNAL);
        assertThat(normalizer.inferCategory("misc", Map.of())).isEqualTo(SpanCategory.OTHER);
    }

    @Test
    @DisplayName("Missing required fields are rejected")
    void rejectsMissingFields() {
        assertThatThrownBy(() -> normalizer.normalize(draft().id(null).build()))
                .isInstanceOf(InvalidSpanException.class);
        assertThatThrownBy(() -> normalizer.normalize(draft().traceId("").build()))
                .isInstanceOf(InvalidSpanException.class);
        assertThatThrownBy(() -> normalizer.normalize(draft().origin(null).build()))
                .isInstanceOf(InvalidSpanException.class)
                .hasMessageContaining("origin");
    }
}
