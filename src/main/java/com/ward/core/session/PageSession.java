package com.ward.core.session;

import com.ward.core.span.NavigationType;
import lombok.Builder;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * One page view or client navigation, rebuilt wholesale whenever its spans or navigation event change.
 *
 * {@code resources} is always the pre-order flattening of {@code rootResources}.
 */
@Builder(toBuilder = true)
public record PageSession(
        String id,
        String projectId,
        String url,
        String route,
        NavigationType navigationType,
        String previousSessionId,
        PageTiming timing,
        List<Resource> resources,
        List<Resource> rootResources,
        SessionStats stats
) {

    /**
     * Orders sessions by navigation start, newest first.
     */
    public static final Comparator<PageSession> NEWEST_FIRST =
            Comparator.comparingDouble((PageSession session) -> session.timing().navigationStart()).reversed();

    public PageSession {
        resources = resources == null ? List.of() : List.copyOf(resources);
        rootResources = rootResources == null ? List.of() : List.copyOf(rootResources);
        if (stats == null) {
            stats = SessionStats.EMPTY;
        }
    }

    public static List<PageSession> sortNewestFirst(Collection<PageSession> sessions) {
        return sessions.stream()
                .sorted(NEWEST_FIRST)
                .toList();
    }
}
