package com.ward.core.service.api.advice;

import com.ward.core.service.api.dto.ApiResponse;
import com.ward.core.service.ingest.IngestionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Maps exceptions escaping the controllers onto the {@link ApiResponse} error envelope.
 *
 * Malformed input is a 400; ingestion refusals carry their own status.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // ==================== Bad Input ====================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("Rejected request: {}", details);
        return badRequest("Validation failed", "VALIDATION_ERROR", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return badRequest("Malformed request body", "VALIDATION_ERROR", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad value for parameter {}: {}", ex.getName(), ex.getValue());
        return badRequest("Invalid value for parameter '" + ex.getName() + "'", "INVALID_ARGUMENT",
                String.valueOf(ex.getValue()));
    }

    /**
     * Unknown enum wire values (navigation type, severity, category) and negative limits.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());
        return badRequest(ex.getMessage(), "INVALID_ARGUMENT", null);
    }

    // ==================== Ingestion ====================

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<ApiResponse<Void>> handleIngestionException(IngestionException ex) {
        HttpStatus status;
        if (IngestionException.INGESTION_DISABLED.equals(ex.getErrorCode())) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
            log.warn("Ingestion refused: {}", ex.getMessage());
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            log.error("Ingestion error: {} [{}] entity={}", ex.getMessage(), ex.getErrorCode(), ex.getEntityId(), ex);
        }
        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    // ==================== Fallbacks ====================

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResource(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("No endpoint at /" + ex.getResourcePath(), "NOT_FOUND"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred", "INTERNAL_ERROR", ex.getMessage()));
    }

    private static ResponseEntity<ApiResponse<Void>> badRequest(String message, String code, String details) {
        return ResponseEntity.badRequest()
                .body(ApiResponse.error(message, code, details));
    }
}
