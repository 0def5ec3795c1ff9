package com.ward.core.issue;

import com.ward.core.session.PageSession;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs issue detectors against a session and post-processes their findings.
 */
@Slf4j
public class IssueDetectionEngine {

    /**
     * Most severe first, then largest time impact first.
     */
    public static final Comparator<DetectedIssue> ISSUE_ORDER = Comparator
            .comparingInt((DetectedIssue issue) -> issue.severity().getRank())
            .thenComparing(Comparator.comparingDouble((DetectedIssue issue) -> issue.match().impact().timeMs()).reversed());

    /**
     * Runs every detector against the session.
     *
     * A detector that throws is logged and contributes nothing.
     *
     * @return detected issues in {@link #ISSUE_ORDER}
     */
    public List<DetectedIssue> runDetectors(PageSession session, List<IssueDetector> detectors) {
        List<DetectedIssue> issues = new ArrayList<>();
        for (IssueDetector detector : detectors) {
            safeDetect(detector, session).ifPresent(match ->
                    issues.add(new DetectedIssue(detector.definition(), match, detector.suggest(match))));
        }
        issues.sort(ISSUE_ORDER);
        return issues;
    }

    private Optional<IssueMatch> safeDetect(IssueDetector detector, PageSession session) {
        try {
            return detector.detect(session);
        } catch (RuntimeException e) {
            log.error("Issue detector {} failed on session {}", detector.definition().id(), session.id(), e);
            return Optional.empty();
        }
    }

    // ==================== Filters ====================

    public static List<DetectedIssue> filterBySeverity(List<DetectedIssue> issues, IssueSeverity minSeverity) {
        return issues.stream()
                .filter(issue -> issue.severity().isAtLeast(minSeverity))
                .toList();
    }

    public static List<DetectedIssue> filterByCategory(List<DetectedIssue> issues, Collection<IssueCategory> categories) {
        return issues.stream()
                .filter(issue -> categories.contains(issue.category()))
                .toList();
    }

    /**
     * Groups issues by category, categories in order of first appearance.
     */
    public static Map<IssueCategory, List<DetectedIssue>> groupByCategory(List<DetectedIssue> issues) {
        return issues.stream()
                .collect(Collectors.groupingBy(DetectedIssue::category, LinkedHashMap::new, Collectors.toList()));
    }

    public static List<DetectedIssue> filterByMinTime(List<DetectedIssue> issues, double minTimeMs) {
        return issues.stream()
                .filter(issue -> issue.match().impact().timeMs() >= minTimeMs)
                .toList();
    }

    public static List<DetectedIssue> takeTop(List<DetectedIssue> issues, int n) {
        return issues.stream()
                .limit(Math.max(n, 0))
                .toList();
    }

    public static double totalTimeImpact(List<DetectedIssue> issues) {
        return issues.stream()
                .mapToDouble(issue -> issue.match().impact().timeMs())
                .sum();
    }
}
