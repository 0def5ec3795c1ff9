package com.ward.core.service.runtime;

import com.ward.core.service.config.MetricsConfig;
import com.ward.core.service.config.RetentionConfig;
import com.ward.core.session.PageSession;
import com.ward.core.session.Resource;
import com.ward.core.session.ResourceQueries;
import com.ward.core.session.SessionCorrelator;
import com.ward.core.session.SessionProcessor;
import com.ward.core.session.SessionState;
import com.ward.core.span.NavigationEvent;
import com.ward.core.span.RawSpan;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory implementation of SessionTracker.
 *
 * Holds one {@link SessionState} guarded by a lock. Each ingest correlates, rebuilds the
 * affected sessions and enforces the retention limit while holding the lock, so readers
 * never observe a half-applied batch.
 */
@Slf4j
@Component
public class InMemorySessionTracker implements SessionTracker {

    private final SessionProcessor sessionProcessor;
    private final MetricsConfig metricsConfig;
    private final RetentionConfig retentionConfig;

    private final SessionState state = new SessionState();
    private final SessionCorrelator correlator = new SessionCorrelator(state);
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private long generation;

    public InMemorySessionTracker(SessionProcessor sessionProcessor,
                                  MetricsConfig metricsConfig,
                                  RetentionConfig retentionConfig) {
        this.sessionProcessor = sessionProcessor;
        this.metricsConfig = metricsConfig;
        this.retentionConfig = retentionConfig;
    }

    @PostConstruct
    void init() {
        metricsConfig.registerGauge(
                "ward.store.sessions.count",
                "Number of page sessions in memory",
                this::getSessionCount
        );
        metricsConfig.registerGauge(
                "ward.store.orphans.count",
                "Number of spans not yet assigned to a session",
                this::getOrphanCount
        );
        log.info("InMemorySessionTracker initialized, max sessions: {}",
                retentionConfig.getSession().getMaxCount());
    }

    // ==================== Writes ====================

    @Override
    public Set<String> ingestSpans(List<RawSpan> spans) {
        return withLock(() -> applySpans(spans));
    }

    @Override
    public Optional<Set<String>> ingestSpans(List<RawSpan> spans, long generation) {
        return withLock(() -> {
            if (isStale(generation)) {
                log.debug("Dropping {} spans accepted before the last clear", spans.size());
                return Optional.empty();
            }
            return Optional.of(applySpans(spans));
        });
    }

    @Override
    public void ingestNavigationEvent(NavigationEvent event) {
        withLock(() -> {
            applyNavigationEvent(event);
            return null;
        });
    }

    @Override
    public boolean ingestNavigationEvent(NavigationEvent event, long generation) {
        return withLock(() -> {
            if (isStale(generation)) {
                log.debug("Dropping navigation event for {} accepted before the last clear", event.sessionId());
                return false;
            }
            applyNavigationEvent(event);
            return true;
        });
    }

    private Set<String> applySpans(List<RawSpan> spans) {
        return metricsConfig.getRebuildTimer().record(() -> {
            Set<String> affected = new LinkedHashSet<>();
            for (RawSpan span : spans) {
                affected.addAll(correlator.ingest(span));
            }
            rebuild(affected);
            return affected;
        });
    }

    private void applyNavigationEvent(NavigationEvent event) {
        metricsConfig.getRebuildTimer().record(() -> {
            state.putNavigationEvent(event);
            rebuild(Set.of(event.sessionId()));
        });
    }

    private boolean isStale(long itemGeneration) {
        return itemGeneration != generation;
    }

    private void rebuild(Set<String> sessionIds) {
        if (sessionIds.isEmpty()) {
            return;
        }
        sessionProcessor.process(state, sessionIds);
        metricsConfig.getSessionRebuilds().increment(sessionIds.size());

        int evicted = state.enforceLimit(retentionConfig.getSession().getMaxCount());
        if (evicted > 0) {
            log.info("Evicted {} oldest sessions (limit {})", evicted, retentionConfig.getSession().getMaxCount());
        }
    }

    @Override
    public void clear() {
        long cleared = withLock(() -> {
            state.clear();
            return ++generation;
        });
        log.info("Session state cleared, recording generation {}", cleared);
    }

    // ==================== Reads ====================

    @Override
    public List<PageSession> getSessions() {
        return withLock(() -> PageSession.sortNewestFirst(state.sessions()));
    }

    @Override
    public List<PageSession> getSessionsByProject(String projectId) {
        return getSessions().stream()
                .filter(session -> Objects.equals(session.projectId(), projectId))
                .toList();
    }

    @Override
    public List<PageSession> getSessionsByRoute(String route) {
        return getSessions().stream()
                .filter(session -> Objects.equals(session.route(), route))
                .toList();
    }

    @Override
    public Optional<PageSession> getSession(String sessionId) {
        return withLock(() -> state.getSession(sessionId));
    }

    @Override
    public List<Resource> getErrors() {
        return ResourceQueries.errors(getSessions());
    }

    @Override
    public List<Resource> getSlowResources(double thresholdMs) {
        return ResourceQueries.slowResources(getSessions(), thresholdMs);
    }

    @Override
    public long getGeneration() {
        return withLock(() -> generation);
    }

    @Override
    public int getSessionCount() {
        return withLock(state::sessionCount);
    }

    @Override
    public int getSpanCount() {
        return withLock(state::spanCount);
    }

    @Override
    public int getOrphanCount() {
        return withLock(state::orphanCount);
    }

    // ==================== Helper Methods ====================

    private <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
