package com.ward.core.service.runtime;

import com.ward.core.session.PageSession;
import com.ward.core.session.Resource;
import com.ward.core.span.NavigationEvent;
import com.ward.core.span.RawSpan;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Interface for the session tracker.
 *
 * Owns the correlation state of the current recording. Writes come from the ingestion
 * worker; reads return immutable snapshots and may happen on any thread.
 */
public interface SessionTracker {

    /**
     * Correlates spans into sessions and rebuilds every session whose span set changed.
     *
     * @param spans normalized spans, in arrival order
     * @return ids of the sessions rebuilt
     */
    Set<String> ingestSpans(List<RawSpan> spans);

    /**
     * Like {@link #ingestSpans(List)}, but only while {@code generation} is still the
     * current recording.
     *
     * @return ids of the sessions rebuilt, or empty when the recording was cleared since
     */
    Optional<Set<String>> ingestSpans(List<RawSpan> spans, long generation);

    /**
     * Records a navigation event and rebuilds its session.
     *
     * @param event the navigation event
     */
    void ingestNavigationEvent(NavigationEvent event);

    /**
     * Records a navigation event unless the recording was cleared after {@code generation}.
     *
     * @return whether the event was applied
     */
    boolean ingestNavigationEvent(NavigationEvent event, long generation);

    /**
     * Generation of the current recording; incremented by {@link #clear()}.
     */
    long getGeneration();

    /**
     * All sessions, newest first.
     */
    List<PageSession> getSessions();

    List<PageSession> getSessionsByProject(String projectId);

    List<PageSession> getSessionsByRoute(String route);

    Optional<PageSession> getSession(String sessionId);

    /**
     * Failed resources across all sessions, most recent first.
     */
    List<Resource> getErrors();

    /**
     * Resources at least {@code thresholdMs} long across all sessions, slowest first.
     */
    List<Resource> getSlowResources(double thresholdMs);

    /**
     * Discards all spans, sessions and navigation events and starts a new generation.
     */
    void clear();

    int getSessionCount();

    int getSpanCount();

    int getOrphanCount();
}
