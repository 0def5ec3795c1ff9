package com.ward.core.service.api.dto;

import com.ward.core.span.NavigationEvent;
import com.ward.core.span.NavigationTiming;
import com.ward.core.span.NavigationType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for navigation event ingestion requests, as reported by the browser.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NavigationEventRequest {

    @NotBlank(message = "sessionId is required")
    private String sessionId;

    /**
     * Defaults to {@code unknown-project} when absent.
     */
    private String projectId;

    private String url;

    private String route;

    /**
     * {@code initial}, {@code navigation} or {@code back-forward}.
     */
    @NotBlank(message = "navigationType is required")
    private String navigationType;

    private String previousSessionId;

    @Valid
    @NotNull(message = "timing is required")
    private TimingDto timing;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimingDto {

        @NotNull(message = "timing.navigationStart is required")
        private Double navigationStart;

        private Double responseStart;
        private Double domContentLoaded;
        private Double load;
        private Double fcp;
        private Double lcp;
    }

    /**
     * Converts to a domain event.
     *
     * @throws IllegalArgumentException if the navigation type is unknown
     */
    public NavigationEvent toEvent() {
        return NavigationEvent.builder()
                .sessionId(sessionId)
                .projectId(projectId)
                .url(url)
                .route(route)
                .navigationType(NavigationType.fromValue(navigationType))
                .previousSessionId(previousSessionId)
                .timing(new NavigationTiming(
                        timing.getNavigationStart(),
                        timing.getResponseStart(),
                        timing.getDomContentLoaded(),
                        timing.getLoad(),
                        timing.getFcp(),
                        timing.getLcp()))
                .build();
    }
}
