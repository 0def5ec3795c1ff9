package com.ward.core.session;

import com.ward.core.span.RawSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.ward.core.session.SpanFixtures.span;
import static org.assertj.core.api.Assertions.assertThat;

class SessionCorrelatorTest {

    @Test
    @DisplayName("A span with its own session tag is assigned directly")
    void assignsTaggedSpan() {
        SessionState state = new SessionState();
        SessionCorrelator correlator = new SessionCorrelator(state);

        assertThat(correlator.ingest(span("a", null, "nav_1", 0, 10))).containsExactly("nav_1");
        assertThat(state.sessionSpanIds("nav_1")).containsExactly("a");
        assertThat(state.orphanCount()).isZero();
    }

    @Test
    @DisplayName("Child before parent resolves to the same assignment as parent before child")
    void orderIndependent() {
        RawSpan parent = span("b", null, "nav_1", 0, 100);
        RawSpan child = span("a", "b", null, 10, 50);

        SessionState parentFirst = new SessionState();
        SessionCorrelator first = new SessionCorrelator(parentFirst);
        first.ingest(parent);
        first.ingest(child);

        SessionState childFirst = new SessionState();
        SessionCorrelator second = new SessionCorrelator(childFirst);
        assertThat(second.ingest(child)).isEmpty();
        assertThat(childFirst.isOrphan("a")).isTrue();
        assertThat(second.ingest(parent)).containsExactly("nav_1");

        assertThat(childFirst.sessionSpanIds("nav_1"))
                .containsExactlyInAnyOrderElementsOf(parentFirst.sessionSpanIds("nav_1"));
        assertThat(childFirst.orphanCount()).isZero();
    }

    @Test
    @DisplayName("Deep descendants resolve through untagged ancestors")
    void resolvesThroughAncestors() {
        SessionState state = new SessionState();
        SessionCorrelator correlator = new SessionCorrelator(state);

        correlator.ingest(span("c", "b", null, 20, 30));
        correlator.ingest(span("b", "a", null, 10, 40));
        correlator.ingest(span("a", null, "srv_1", 0, 50));

        assertThat(state.sessionSpanIds("srv_1")).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(state.orphanCount()).isZero();
    }

    @Test
    @DisplayName("Re-ingesting the same span leaves the state unchanged")
    void idempotentReingest() {
        SessionState state = new SessionState();
        SessionCorrelator correlator = new SessionCorrelator(state);
        RawSpan root = span("a", null, "nav_1", 0, 10);

        correlator.ingest(root);
        correlator.ingest(root);

        assertThat(state.spanCount()).isEqualTo(1);
        assertThat(state.sessionSpanIds("nav_1")).containsExactly("a");
    }

    @Test
    @DisplayName("A span whose parent never arrives stays orphaned")
    void permanentOrphan() {
        SessionState state = new SessionState();
        SessionCorrelator correlator = new SessionCorrelator(state);

        correlator.ingest(span("lost", "missing", null, 0, 10));
        correlator.ingest(span("a", null, "nav_1", 0, 10));

        assertThat(state.isOrphan("lost")).isTrue();
        assertThat(state.sessionSpanIds("nav_1")).doesNotContain("lost");
    }

    @Test
    @DisplayName("A parent cycle without a session tag stays unresolved")
    void cycleIsUnresolved() {
        SessionState state = new SessionState();
        SessionCorrelator correlator = new SessionCorrelator(state);

        correlator.ingest(span("x", "y", null, 0, 10));
        correlator.ingest(span("y", "x", null, 0, 10));

        assertThat(correlator.findSessionId(state.getSpan("x").orElseThrow())).isEmpty();
        assertThat(state.orphanIds()).containsExactly("x", "y");
    }
}
