package com.ward.core.issue.detector;

import com.ward.core.issue.IssueCategory;
import com.ward.core.issue.IssueDetectionEngine;
import com.ward.core.issue.IssueDetector;
import com.ward.core.issue.IssueMatch;
import com.ward.core.issue.IssueSeverity;
import com.ward.core.issue.IssueSuggestion;
import com.ward.core.issue.algorithm.NPlusOnePattern;
import com.ward.core.session.PageSession;
import com.ward.core.session.Resource;
import com.ward.core.session.ResourceType;
import com.ward.core.span.SpanAttributes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.ward.core.issue.IssueFixtures.server;
import static com.ward.core.issue.IssueFixtures.session;
import static com.ward.core.issue.IssueFixtures.withInitiator;
import static com.ward.core.issue.IssueFixtures.withParent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class DetectorsTest {

    @Test
    @DisplayName("Built-in detector sets have stable ids and categories")
    void detectorSets() {
        assertThat(Detectors.ALL).extracting(detector -> detector.definition().id())
                .containsExactly(
                        ParentChildWaterfallDetector.ID,
                        SequentialAwaitsDetector.ID,
                        NPlusOneDetector.ID,
                        UncachedFetchDetector.ID);
        assertThat(Detectors.WATERFALL).allMatch(detector -> detector.definition().category() == IssueCategory.WATERFALL);
        assertThat(Detectors.CACHING).containsExactly(Detectors.UNCACHED_FETCH);
        assertThat(Detectors.DATA_FETCHING).containsExactly(Detectors.N_PLUS_ONE);
    }

    @Test
    @DisplayName("A clean session has no issues")
    void cleanSession() {
        PageSession clean = session(List.of(
                server("page", ResourceType.RENDER, "/page", 0, 40),
                withParent(server("data", ResourceType.DATABASE, "db", 5, 20), "page")));

        assertThat(new IssueDetectionEngine().runDetectors(clean, Detectors.ALL)).isEmpty();
    }

    @Nested
    @DisplayName("Parent-child waterfall")
    class ParentChild {

        private final IssueDetector detector = Detectors.PARENT_CHILD_WATERFALL;

        @Test
        @DisplayName("Reports a server child that waits for its parent")
        void detectsBlockedChild() {
            PageSession session = session(List.of(
                    server("layout", ResourceType.RENDER, "/layout", 0, 300),
                    withParent(server("posts", ResourceType.FETCH, "https://cms.example.com/posts", 305, 400), "layout")));

            Optional<IssueMatch> match = detector.detect(session);

            assertThat(match).isPresent();
            assertThat(match.get().severity()).isEqualTo(IssueSeverity.WARNING);
            assertThat(match.get().impact().timeMs()).isEqualTo(95.0);
            assertThat(match.get().contextValue("childResource", Resource.class).id()).isEqualTo("posts");

            IssueSuggestion suggestion = detector.suggest(match.get());
            assertThat(suggestion.summary()).isNotBlank();
            assertThat(suggestion.codeExample().language()).isEqualTo("typescript");
        }

        @Test
        @DisplayName("Ignores blocking below the wasted time threshold")
        void ignoresSmallWaste() {
            PageSession session = session(List.of(
                    server("parent", ResourceType.RENDER, "/page", 0, 200),
                    withParent(server("child", ResourceType.FETCH, "/api/child", 205, 250), "parent")));

            assertThat(detector.detect(session)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Sequential awaits")
    class SequentialAwaits {

        private final IssueDetector detector = Detectors.SEQUENTIAL_AWAITS;

        @Test
        @DisplayName("Reports back-to-back fetches from one source line")
        void detectsSequentialFetches() {
            PageSession session = session(List.of(
                    withInitiator(server("user", ResourceType.FETCH, "https://api.example.com/user", 0, 100), "page.tsx:8"),
                    withInitiator(server("cart", ResourceType.FETCH, "https://api.example.com/cart", 105, 205), "page.tsx:8")));

            Optional<IssueMatch> match = detector.detect(session);

            assertThat(match).isPresent();
            assertThat(match.get().severity()).isEqualTo(IssueSeverity.WARNING);
            assertThat(match.get().impact().timeMs()).isEqualTo(100.0);
            assertThat(match.get().impact().percentOfTotal()).isCloseTo(48.78, offset(0.01));
            assertThat(match.get().contextValue("initiator", String.class)).isEqualTo("page.tsx:8");
            assertThat(match.get().contextValue("chainLength", Integer.class)).isEqualTo(2);
        }

        @Test
        @DisplayName("Wasted time above the critical threshold is critical")
        void criticalWhenLong() {
            PageSession session = session(List.of(
                    withInitiator(server("a", ResourceType.FETCH, "https://api.example.com/a", 0, 200), "page.tsx:8"),
                    withInitiator(server("b", ResourceType.FETCH, "https://api.example.com/b", 201, 401), "page.tsx:8")));

            assertThat(detector.detect(session)).get()
                    .extracting(IssueMatch::severity)
                    .isEqualTo(IssueSeverity.CRITICAL);
        }
    }

    @Nested
    @DisplayName("N+1 requests")
    class NPlusOne {

        private final IssueDetector detector = Detectors.N_PLUS_ONE;

        private PageSession sessionWithUserFetches(int count) {
            List<Resource> resources = new ArrayList<>();
            for (int i = 1; i <= count; i++) {
                resources.add(withInitiator(
                        server("u" + i, ResourceType.API, "/api/users/" + i, i * 10, i * 10 + 40), "list.tsx:10"));
            }
            return session(resources);
        }

        @Test
        @DisplayName("Reports repeated per-item requests")
        void detectsRepeatedRequests() {
            Optional<IssueMatch> match = detector.detect(sessionWithUserFetches(3));

            assertThat(match).isPresent();
            assertThat(match.get().severity()).isEqualTo(IssueSeverity.WARNING);
            assertThat(match.get().contextValue("pattern", String.class)).isEqualTo("/api/users/*");
            assertThat(match.get().contextValue("entityType", String.class)).isEqualTo("users");
            assertThat(match.get().contextValue("allPatterns", List.class)).hasSize(1)
                    .first().isInstanceOf(NPlusOnePattern.class);
            assertThat(detector.suggest(match.get()).summary()).contains("3 requests");
        }

        @Test
        @DisplayName("More than ten requests is critical, fewer than three is nothing")
        void severityByCount() {
            assertThat(detector.detect(sessionWithUserFetches(11))).get()
                    .extracting(IssueMatch::severity)
                    .isEqualTo(IssueSeverity.CRITICAL);
            assertThat(detector.detect(sessionWithUserFetches(2))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Uncached fetch")
    class UncachedFetch {

        private final IssueDetector detector = Detectors.UNCACHED_FETCH;

        private Resource rates(String id, double start, double end) {
            return server(id, ResourceType.FETCH, "https://api.example.com/rates/" + id, start, end);
        }

        @Test
        @DisplayName("Reports slow uncached GET fetches")
        void detectsUncachedFetch() {
            Optional<IssueMatch> match = detector.detect(session(List.of(rates("r1", 0, 100))));

            assertThat(match).isPresent();
            assertThat(match.get().severity()).isEqualTo(IssueSeverity.INFO);
            assertThat(match.get().contextValue("count", Integer.class)).isEqualTo(1);
            assertThat(detector.suggest(match.get()).docsUrl()).isNotBlank();
        }

        @Test
        @DisplayName("Skips cached, internal, mutating and fast requests")
        void skipsNonCandidates() {
            Resource cached = rates("cached", 0, 100).toBuilder().cached(true).build();
            Resource local = server("local", ResourceType.FETCH, "http://localhost:3000/api/x", 0, 100);
            Resource post = rates("post", 0, 100).toBuilder()
                    .attributes(Map.of(SpanAttributes.HTTP_METHOD, "POST"))
                    .build();
            Resource fast = rates("fast", 0, 10);

            assertThat(detector.detect(session(List.of(cached, local, post, fast)))).isEmpty();
        }

        @Test
        @DisplayName("Severity grows with count and total time")
        void severityByVolume() {
            List<Resource> six = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                six.add(rates("w" + i, i * 100, i * 100 + 60));
            }
            assertThat(detector.detect(session(six))).get()
                    .extracting(IssueMatch::severity)
                    .isEqualTo(IssueSeverity.WARNING);

            assertThat(detector.detect(session(List.of(rates("slow", 0, 600))))).get()
                    .extracting(IssueMatch::severity)
                    .isEqualTo(IssueSeverity.CRITICAL);
        }

        @Test
        @DisplayName("Internal and non-idempotent requests are recognized")
        void classifiesRequests() {
            assertThat(UncachedFetchDetector.isInternalRequest(
                    server("n", ResourceType.FETCH, "/_next/data/page.json", 0, 1))).isTrue();
            assertThat(UncachedFetchDetector.looksIdempotent(
                    server("g", ResourceType.FETCH, "https://api.example.com/x", 0, 1))).isTrue();
            assertThat(UncachedFetchDetector.looksIdempotent(
                    server("d", ResourceType.FETCH, "https://api.example.com/x", 0, 1).toBuilder()
                            .name("DELETE https://api.example.com/x")
                            .build())).isFalse();
        }
    }
}
