package com.ward.core.issue;

import com.ward.core.session.PageSession;

/**
 * Time attributed to an issue, absolute and relative to the session's duration.
 */
public record IssueImpact(double timeMs, double percentOfTotal) {

    public static IssueImpact of(double timeMs, PageSession session) {
        double totalDuration = session.stats().totalDuration();
        double percent = totalDuration > 0 ? timeMs / totalDuration * 100 : 0;
        return new IssueImpact(timeMs, percent);
    }
}
