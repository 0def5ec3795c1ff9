package com.ward.core.service.api.dto;

import com.ward.core.span.RawSpan;
import com.ward.core.span.SpanCategory;
import com.ward.core.span.SpanOrigin;
import com.ward.core.span.SpanStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * DTO for span ingestion requests.
 *
 * Spans are validated one by one; a malformed span is skipped without rejecting the batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpanIngestRequest {

    @NotNull(message = "spans is required")
    private List<SpanDto> spans;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SpanDto {

        private String id;
        private String parentId;
        private String traceId;
        private String name;

        /**
         * {@code client} or {@code server}.
         */
        private String origin;

        /**
         * Optional; inferred from name and attributes when absent or unknown.
         */
        private String category;

        /**
         * Start time in milliseconds.
         */
        private Double startTime;

        /**
         * End time in milliseconds.
         */
        private Double endTime;

        /**
         * {@code ok}, {@code error} or {@code unset} (default).
         */
        private String status;

        private Map<String, Object> attributes;

        private String sessionId;
        private String projectId;
        private String requestId;

        /**
         * Converts to an unnormalized span.
         *
         * @throws IllegalArgumentException if origin or status is not a known value
         */
        public RawSpan toDraft() {
            double start = startTime != null ? startTime : Double.NaN;
            double end = endTime != null ? endTime : Double.NaN;
            return RawSpan.builder()
                    .id(id)
                    .parentId(parentId)
                    .traceId(traceId)
                    .name(name)
                    .origin(origin != null ? SpanOrigin.fromValue(origin) : null)
                    .category(category != null ? SpanCategory.lookup(category).orElse(null) : null)
                    .startTime(start)
                    .endTime(end)
                    .duration(end - start)
                    .status(SpanStatus.fromValue(status))
                    .attributes(attributes)
                    .sessionId(sessionId)
                    .projectId(projectId)
                    .requestId(requestId)
                    .build();
        }
    }
}
