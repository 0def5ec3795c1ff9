package com.ward.core.session;

import com.ward.core.span.NavigationEvent;
import com.ward.core.span.NavigationType;
import com.ward.core.span.RawSpan;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Builds a {@link PageSession} from the spans of one session and its optional navigation event.
 *
 * The result depends only on its inputs; rebuilding with the same spans yields an equal session.
 */
public class SessionBuilder {

    static final String UNKNOWN_PROJECT = "unknown";

    /**
     * @param sessionId       id of the session being built
     * @param spans           spans assigned to the session, in any order
     * @param navigationEvent the session's navigation event, or {@code null}
     * @return the session, or empty when every span is noise
     */
    public Optional<PageSession> build(String sessionId, Collection<RawSpan> spans, NavigationEvent navigationEvent) {
        List<RawSpan> sortedSpans = spans.stream()
                .filter(span -> !NoiseFilter.isNoise(span))
                .sorted(Comparator.comparingDouble(RawSpan::startTime))
                .toList();
        if (sortedSpans.isEmpty()) {
            return Optional.empty();
        }

        String projectId = resolveProjectId(sortedSpans, navigationEvent);
        List<Resource> resources = sortedSpans.stream()
                .map(span -> ResourceFactory.fromSpan(span, sessionId, projectId))
                .toList();
        List<Resource> rootResources = ResourceTree.build(resources);
        List<Resource> flatResources = ResourceTree.flatten(rootResources);

        NavigationType navigationType = navigationEvent != null
                ? navigationEvent.navigationType()
                : NavigationTypeClassifier.classify(sortedSpans);

        return Optional.of(PageSession.builder()
                .id(sessionId)
                .projectId(projectId)
                .url(navigationEvent != null && navigationEvent.url() != null
                        ? navigationEvent.url()
                        : RouteExtractor.extractSessionUrl(sortedSpans))
                .route(navigationEvent != null && navigationEvent.route() != null
                        ? navigationEvent.route()
                        : RouteExtractor.extractRoute(sortedSpans))
                .navigationType(navigationType)
                .previousSessionId(navigationEvent != null ? navigationEvent.previousSessionId() : null)
                .timing(PageTimingCalculator.compute(flatResources, navigationEvent, navigationType))
                .resources(flatResources)
                .rootResources(rootResources)
                .stats(SessionStats.of(flatResources))
                .build());
    }

    /**
     * Placeholder session for a navigation whose spans have not arrived yet.
     */
    public PageSession buildEmpty(NavigationEvent navigationEvent) {
        return PageSession.builder()
                .id(navigationEvent.sessionId())
                .projectId(navigationEvent.projectId())
                .url(navigationEvent.url() != null ? navigationEvent.url() : RouteExtractor.UNKNOWN_ROUTE)
                .route(navigationEvent.route() != null ? navigationEvent.route() : RouteExtractor.UNKNOWN_ROUTE)
                .navigationType(navigationEvent.navigationType())
                .previousSessionId(navigationEvent.previousSessionId())
                .timing(PageTimingCalculator.fromEvent(navigationEvent))
                .resources(List.of())
                .rootResources(List.of())
                .stats(SessionStats.EMPTY)
                .build();
    }

    private static String resolveProjectId(List<RawSpan> sortedSpans, NavigationEvent navigationEvent) {
        if (navigationEvent != null && navigationEvent.projectId() != null) {
            return navigationEvent.projectId();
        }
        return sortedSpans.stream()
                .map(RawSpan::projectId)
                .filter(id -> id != null && !id.isEmpty())
                .findFirst()
                .orElse(UNKNOWN_PROJECT);
    }
}
