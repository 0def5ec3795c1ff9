package com.ward.core.service.api.controller;

import com.ward.core.issue.DetectedIssue;
import com.ward.core.issue.IssueCategory;
import com.ward.core.issue.IssueSeverity;
import com.ward.core.service.api.dto.ApiResponse;
import com.ward.core.service.api.dto.SessionSummaryResponse;
import com.ward.core.service.engine.IssueDetectionAdapter;
import com.ward.core.service.ingest.IngestionQueue;
import com.ward.core.service.runtime.SessionTracker;
import com.ward.core.service.stream.SessionUpdatePublisher;
import com.ward.core.session.PageSession;
import com.ward.core.session.Resource;
import com.ward.core.session.ResourceQueries;
import com.ward.core.session.ResourceQueries.ResourceFilter;
import com.ward.core.session.ResourceType;
import com.ward.core.span.SpanOrigin;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Controller for page session queries and management.
 */
@Slf4j
@RestController
@RequestMapping("/sessions")
@Tag(name = "Page Sessions", description = "Endpoints for querying page sessions and their issues")
@RequiredArgsConstructor
public class SessionController {

    private final SessionTracker sessionTracker;
    private final IssueDetectionAdapter issueDetection;
    private final IngestionQueue ingestionQueue;
    private final SessionUpdatePublisher publisher;

    // ==================== Endpoints ====================

    @GetMapping
    @Operation(summary = "List sessions", description = "Returns session summaries, newest first, optionally filtered")
    public ResponseEntity<ApiResponse<List<SessionSummaryResponse>>> getSessions(
            @Parameter(description = "Only sessions of this project") @RequestParam(required = false) String projectId,
            @Parameter(description = "Only sessions for this route") @RequestParam(required = false) String route) {

        List<PageSession> sessions;
        if (projectId != null) {
            sessions = sessionTracker.getSessionsByProject(projectId).stream()
                    .filter(session -> route == null || route.equals(session.route()))
                    .toList();
        } else if (route != null) {
            sessions = sessionTracker.getSessionsByRoute(route);
        } else {
            sessions = sessionTracker.getSessions();
        }

        var summaries = sessions.stream()
                .map(SessionSummaryResponse::from)
                .toList();

        log.debug("Returning {} session summaries", summaries.size());
        return ResponseEntity.ok(ApiResponse.success(summaries));
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Get session by ID", description = "Returns the session with its resource tree, timing and stats")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Session found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Session not found")
    })
    public ResponseEntity<ApiResponse<PageSession>> getSession(
            @Parameter(description = "Session ID") @PathVariable String sessionId) {
        return sessionTracker.getSession(sessionId)
                .map(session -> ResponseEntity.ok(ApiResponse.success(session)))
                .orElseGet(() -> notFoundResponse(sessionId));
    }

    @GetMapping("/{sessionId}/issues")
    @Operation(summary = "Detect session issues",
               description = "Runs the issue detectors on a session, most severe and most costly first")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Issues detected"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Unknown severity or category"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Session not found")
    })
    public ResponseEntity<ApiResponse<List<DetectedIssue>>> getIssues(
            @Parameter(description = "Session ID") @PathVariable String sessionId,
            @Parameter(description = "Least severe level to include: critical, warning, info, optimization")
            @RequestParam(required = false) String minSeverity,
            @Parameter(description = "Categories to include, e.g. waterfall, caching, data-fetching")
            @RequestParam(required = false) List<String> category,
            @Parameter(description = "Maximum number of issues")
            @RequestParam(required = false) Integer limit) {

        IssueSeverity severity = minSeverity != null ? IssueSeverity.fromValue(minSeverity) : null;
        Set<IssueCategory> categories = category != null
                ? category.stream().map(IssueCategory::fromValue).collect(Collectors.toSet())
                : null;
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }

        return sessionTracker.getSession(sessionId)
                .map(session -> ResponseEntity.ok(ApiResponse.success(
                        issueDetection.detect(session, severity, categories, limit))))
                .orElseGet(() -> notFoundResponse(sessionId));
    }

    @GetMapping("/{sessionId}/critical-path")
    @Operation(summary = "Get critical path",
               description = "Returns resource ids along the slowest chain from a root resource to a leaf")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Critical path computed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Session not found")
    })
    public ResponseEntity<ApiResponse<List<String>>> getCriticalPath(
            @Parameter(description = "Session ID") @PathVariable String sessionId) {
        return sessionTracker.getSession(sessionId)
                .map(session -> ResponseEntity.ok(ApiResponse.success(
                        ResourceQueries.findCriticalPath(session.rootResources()))))
                .orElseGet(() -> notFoundResponse(sessionId));
    }

    @GetMapping("/{sessionId}/resources")
    @Operation(summary = "Filter session resources",
               description = "Returns the session's resources in tree order, narrowed by the given criteria")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Resources returned"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Unknown type or origin"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Session not found")
    })
    public ResponseEntity<ApiResponse<List<Resource>>> getResources(
            @Parameter(description = "Session ID") @PathVariable String sessionId,
            @Parameter(description = "Case-insensitive match on name or URL")
            @RequestParam(required = false) String search,
            @Parameter(description = "Resource types, e.g. fetch, api, database")
            @RequestParam(required = false) List<String> type,
            @Parameter(description = "Origins: client or server")
            @RequestParam(required = false) List<String> origin,
            @Parameter(description = "Minimum duration in milliseconds")
            @RequestParam(required = false) Double minDuration,
            @Parameter(description = "Only failed resources")
            @RequestParam(defaultValue = "false") boolean errorsOnly) {

        ResourceFilter filter = ResourceFilter.builder()
                .search(search)
                .types(type != null ? type.stream().map(ResourceType::fromValue).collect(Collectors.toSet()) : null)
                .origins(origin != null ? origin.stream().map(SpanOrigin::fromValue).collect(Collectors.toSet()) : null)
                .minDuration(minDuration)
                .showErrorsOnly(errorsOnly)
                .build();

        return sessionTracker.getSession(sessionId)
                .map(session -> ResponseEntity.ok(ApiResponse.success(
                        ResourceQueries.filterResources(session.resources(), filter))))
                .orElseGet(() -> notFoundResponse(sessionId));
    }

    @DeleteMapping
    @Operation(summary = "Clear sessions",
               description = "Discards pending ingestion work, all spans and all sessions to start a fresh recording")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "204", description = "State cleared")
    })
    public ResponseEntity<Void> clearSessions() {
        int discarded = ingestionQueue.clear();
        sessionTracker.clear();
        publisher.requestPublish();

        log.info("Sessions cleared, {} pending work items discarded", discarded);
        return ResponseEntity.noContent().build();
    }

    // ==================== Response Builders ====================

    private <T> ResponseEntity<ApiResponse<T>> notFoundResponse(String sessionId) {
        log.debug("Session not found: {}", sessionId);
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.sessionNotFound(sessionId));
    }
}
