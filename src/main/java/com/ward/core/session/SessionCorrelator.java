package com.ward.core.session;

import com.ward.core.span.RawSpan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns spans to sessions, through their own session tag or the nearest tagged ancestor.
 *
 * Spans whose ancestry cannot be resolved yet are kept as orphans and retried, in the order
 * they were orphaned, after every ingest. Arrival order does not change the final assignment.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionCorrelator {

    private final SessionState state;

    /**
     * Resolves the session of a span by walking its parents through the ingested spans.
     *
     * @return the session id, or empty when an ancestor is missing or the parents form a cycle
     */
    public Optional<String> findSessionId(RawSpan span) {
        Set<String> seen = new HashSet<>();
        RawSpan current = span;

        while (current != null) {
            if (hasText(current.sessionId())) {
                return Optional.of(current.sessionId());
            }
            if (!seen.add(current.id()) || current.parentId() == null) {
                return Optional.empty();
            }
            current = state.getSpan(current.parentId()).orElse(null);
        }
        return Optional.empty();
    }

    /**
     * Attempts to place a stored span into its session.
     *
     * @return the session id the span joined, or empty if it is still unresolved
     */
    public Optional<String> assign(String spanId) {
        Optional<RawSpan> span = state.getSpan(spanId);
        if (span.isEmpty()) {
            return Optional.empty();
        }

        Optional<String> sessionId = findSessionId(span.get());
        sessionId.ifPresent(id -> {
            state.addToSession(id, spanId);
            state.removeOrphan(spanId);
        });
        return sessionId;
    }

    /**
     * Stores a span, assigns it, then retries every orphan.
     *
     * @return ids of the sessions whose span sets gained or refreshed a span
     */
    public Set<String> ingest(RawSpan span) {
        Set<String> affected = new LinkedHashSet<>();
        state.putSpan(span);

        Optional<String> sessionId = assign(span.id());
        if (sessionId.isPresent()) {
            affected.add(sessionId.get());
        } else {
            state.markOrphan(span.id());
        }

        for (String orphanId : state.orphanIds()) {
            assign(orphanId).ifPresent(affected::add);
        }

        if (log.isTraceEnabled()) {
            log.trace("Ingested span {}: sessions={}, orphans={}", span.id(), affected, state.orphanCount());
        }
        return affected;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
