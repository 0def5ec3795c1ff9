package com.ward.core.span;

import lombok.Builder;

import java.util.Objects;

/**
 * Describes one user-perceived navigation, reported by the browser.
 *
 * May arrive before, with, or after the spans of the session it describes.
 */
@Builder(toBuilder = true)
public record NavigationEvent(
        String sessionId,
        String projectId,
        String url,
        String route,
        NavigationType navigationType,
        String previousSessionId,
        NavigationTiming timing
) {

    public static final String DEFAULT_PROJECT_ID = "unknown-project";

    public NavigationEvent {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(navigationType, "navigationType");
        Objects.requireNonNull(timing, "timing");
        if (projectId == null || projectId.isBlank()) {
            projectId = DEFAULT_PROJECT_ID;
        }
    }
}
