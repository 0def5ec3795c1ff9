package com.ward.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JSON envelope shared by every endpoint except the event stream.
 *
 * @param <T> payload type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;

    private T data;

    private ErrorInfo error;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> error(String message, String code) {
        return error(message, code, null);
    }

    public static <T> ApiResponse<T> error(String message, String code, String details) {
        return ApiResponse.<T>builder()
                .success(false)
                .error(new ErrorInfo(message, code, details))
                .build();
    }

    /**
     * Error for a session id that is unknown or was evicted.
     */
    public static <T> ApiResponse<T> sessionNotFound(String sessionId) {
        return error("Session not found: " + sessionId, "NOT_FOUND");
    }

    /**
     * Error for an ingest request rejected because the worker is behind.
     */
    public static <T> ApiResponse<T> queueFull(int utilizationPercent) {
        return error("Ingestion queue is full, please retry later", "QUEUE_FULL",
                "Queue utilization: " + utilizationPercent + "%");
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorInfo {
        private String message;
        private String code;
        private String details;
    }
}
