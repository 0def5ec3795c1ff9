package com.ward.core.service.engine;

import com.ward.core.issue.DetectedIssue;
import com.ward.core.issue.IssueCategory;
import com.ward.core.issue.IssueDetectionEngine;
import com.ward.core.issue.IssueDetector;
import com.ward.core.issue.IssueSeverity;
import com.ward.core.service.config.MetricsConfig;
import com.ward.core.service.config.WardConfig;
import com.ward.core.session.PageSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Service adapter for the issue detection engine.
 *
 * Runs the registered detectors against a session, timing each run, and applies the
 * query filters the API exposes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IssueDetectionAdapter {

    private final IssueDetectionEngine engine;
    private final List<IssueDetector> detectors;
    private final MetricsConfig metricsConfig;
    private final WardConfig wardConfig;

    /**
     * Detects issues in a session.
     *
     * @param session the session to analyze
     * @return issues ordered by severity, then time impact; empty when detection is disabled
     */
    public List<DetectedIssue> detect(PageSession session) {
        if (!wardConfig.getFeatures().isDetectionEnabled()) {
            return List.of();
        }
        List<DetectedIssue> issues = metricsConfig.getDetectionTimer()
                .record(() -> engine.runDetectors(session, detectors));
        if (!issues.isEmpty()) {
            log.debug("Detected {} issues in session {}", issues.size(), session.id());
        }
        return issues;
    }

    /**
     * Detects issues in a session and narrows the result.
     *
     * @param session     the session to analyze
     * @param minSeverity least severe level kept, or null for all
     * @param categories  categories kept, or null/empty for all
     * @param limit       maximum number of issues, or null for all
     * @return the filtered issues
     */
    public List<DetectedIssue> detect(PageSession session, IssueSeverity minSeverity,
                                      Set<IssueCategory> categories, Integer limit) {
        List<DetectedIssue> issues = detect(session);
        if (minSeverity != null) {
            issues = IssueDetectionEngine.filterBySeverity(issues, minSeverity);
        }
        if (categories != null && !categories.isEmpty()) {
            issues = IssueDetectionEngine.filterByCategory(issues, categories);
        }
        if (limit != null) {
            issues = IssueDetectionEngine.takeTop(issues, limit);
        }
        return issues;
    }

    public int getDetectorCount() {
        return detectors.size();
    }
}
