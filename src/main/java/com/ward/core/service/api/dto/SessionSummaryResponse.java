package com.ward.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ward.core.session.PageSession;
import com.ward.core.session.SessionStats;
import com.ward.core.span.NavigationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for session summary responses.
 *
 * Provides a lightweight view of a page session for listing endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionSummaryResponse {

    private String id;
    private String projectId;
    private String url;
    private String route;
    private NavigationType navigationType;
    private String previousSessionId;

    /**
     * Start of the session on the span timeline, in milliseconds.
     */
    private double navigationStart;

    private SessionStats stats;

    public static SessionSummaryResponse from(PageSession session) {
        return SessionSummaryResponse.builder()
                .id(session.id())
                .projectId(session.projectId())
                .url(session.url())
                .route(session.route())
                .navigationType(session.navigationType())
                .previousSessionId(session.previousSessionId())
                .navigationStart(session.timing().navigationStart())
                .stats(session.stats())
                .build();
    }
}
