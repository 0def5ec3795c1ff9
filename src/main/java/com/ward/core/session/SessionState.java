package com.ward.core.session;

import com.ward.core.span.NavigationEvent;
import com.ward.core.span.RawSpan;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything known so far about the current recording.
 *
 * Holds raw spans by id, span-id sets per session, the orphan set, built sessions and
 * navigation events. Not thread-safe: callers serialize every access.
 */
@Slf4j
public class SessionState {

    private final Map<String, RawSpan> spans = new LinkedHashMap<>();
    private final Map<String, Set<String>> sessionSpans = new LinkedHashMap<>();
    private final Set<String> orphanSpans = new LinkedHashSet<>();
    private final Map<String, PageSession> sessions = new LinkedHashMap<>();
    private final Map<String, NavigationEvent> navigationEvents = new LinkedHashMap<>();

    // ==================== Spans ====================

    /**
     * Stores a span, replacing any span with the same id.
     */
    public void putSpan(RawSpan span) {
        spans.put(span.id(), span);
    }

    public Optional<RawSpan> getSpan(String spanId) {
        return Optional.ofNullable(spans.get(spanId));
    }

    public Map<String, RawSpan> spans() {
        return Collections.unmodifiableMap(spans);
    }

    public int spanCount() {
        return spans.size();
    }

    // ==================== Session Membership ====================

    public void addToSession(String sessionId, String spanId) {
        sessionSpans.computeIfAbsent(sessionId, id -> new LinkedHashSet<>()).add(spanId);
    }

    public boolean hasSpanSet(String sessionId) {
        return sessionSpans.containsKey(sessionId);
    }

    public Set<String> sessionSpanIds(String sessionId) {
        return Collections.unmodifiableSet(sessionSpans.getOrDefault(sessionId, Set.of()));
    }

    /**
     * Returns the stored spans assigned to a session, skipping ids whose span is gone.
     */
    public List<RawSpan> spansOf(String sessionId) {
        return sessionSpans.getOrDefault(sessionId, Set.of()).stream()
                .map(spans::get)
                .filter(Objects::nonNull)
                .toList();
    }

    public Map<String, Set<String>> sessionSpans() {
        return Collections.unmodifiableMap(sessionSpans);
    }

    // ==================== Orphans ====================

    public void markOrphan(String spanId) {
        orphanSpans.add(spanId);
    }

    public void removeOrphan(String spanId) {
        orphanSpans.remove(spanId);
    }

    public boolean isOrphan(String spanId) {
        return orphanSpans.contains(spanId);
    }

    /**
     * Snapshot of the orphan ids in the order they were first orphaned.
     */
    public List<String> orphanIds() {
        return new ArrayList<>(orphanSpans);
    }

    public int orphanCount() {
        return orphanSpans.size();
    }

    // ==================== Navigation Events ====================

    public void putNavigationEvent(NavigationEvent event) {
        navigationEvents.put(event.sessionId(), event);
    }

    public Optional<NavigationEvent> getNavigationEvent(String sessionId) {
        return Optional.ofNullable(navigationEvents.get(sessionId));
    }

    public Map<String, NavigationEvent> navigationEvents() {
        return Collections.unmodifiableMap(navigationEvents);
    }

    // ==================== Built Sessions ====================

    public void putSession(PageSession session) {
        sessions.put(session.id(), session);
    }

    public Optional<PageSession> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public boolean hasSession(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public Collection<PageSession> sessions() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Every session id known through a span set or a navigation event, span sets first.
     */
    public Set<String> knownSessionIds() {
        Set<String> ids = new LinkedHashSet<>(sessionSpans.keySet());
        ids.addAll(navigationEvents.keySet());
        return ids;
    }

    // ==================== Lifecycle ====================

    /**
     * Resets all collections, as when a fresh recording starts.
     */
    public void clear() {
        spans.clear();
        sessionSpans.clear();
        orphanSpans.clear();
        sessions.clear();
        navigationEvents.clear();
    }

    /**
     * Keeps only the newest {@code maxSessions} sessions by navigation start.
     *
     * Evicted sessions lose their span set, their navigation event and the spans the set
     * referenced. Eviction is final: late spans of an evicted session cannot restore it.
     *
     * Span sets that never became a session (ids rejected by the id policy, or noise
     * only) are capped at {@code maxSessions} as well, dropping the earliest-seen first.
     *
     * @param maxSessions number of sessions to keep
     * @return number of sessions evicted
     */
    public int enforceLimit(int maxSessions) {
        int keep = Math.max(maxSessions, 0);
        int evicted = 0;
        if (sessions.size() > keep) {
            List<PageSession> ordered = PageSession.sortNewestFirst(sessions.values());
            List<PageSession> toRemove = ordered.subList(keep, ordered.size());
            for (PageSession session : toRemove) {
                evict(session.id());
            }
            evicted = toRemove.size();
            log.debug("Evicted {} sessions, {} remain", evicted, sessions.size());
        }

        int swept = sweepUnbuilt(keep);
        if (swept > 0) {
            log.debug("Dropped {} span sets that never formed a session", swept);
        }
        return evicted;
    }

    private int sweepUnbuilt(int maxUnbuilt) {
        List<String> unbuilt = sessionSpans.keySet().stream()
                .filter(sessionId -> !sessions.containsKey(sessionId))
                .toList();
        int excess = unbuilt.size() - maxUnbuilt;
        for (int i = 0; i < excess; i++) {
            evict(unbuilt.get(i));
        }
        return Math.max(excess, 0);
    }

    private void evict(String sessionId) {
        sessions.remove(sessionId);
        navigationEvents.remove(sessionId);
        Set<String> spanIds = sessionSpans.remove(sessionId);
        if (spanIds != null) {
            spanIds.forEach(spans::remove);
        }
    }
}
