package com.ward.core.service.stream;

import com.ward.core.issue.DetectedIssue;
import com.ward.core.session.PageSession;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot pushed to subscribers after a burst of writes settles.
 *
 * @param sequence    increasing publish number, starting at 1
 * @param sessions    all sessions, newest first
 * @param issues      detected issues per session id
 * @param publishedAt when the snapshot was taken
 */
public record SessionUpdate(
        long sequence,
        List<PageSession> sessions,
        Map<String, List<DetectedIssue>> issues,
        Instant publishedAt
) {

    public SessionUpdate {
        sessions = List.copyOf(sessions);
        issues = Map.copyOf(issues);
    }
}
