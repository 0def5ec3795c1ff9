package com.ward.core.service.ingest;

import lombok.Getter;

/**
 * Raised when telemetry cannot be accepted or applied.
 *
 * {@code errorCode} drives the HTTP status chosen by the exception handler.
 */
@Getter
public class IngestionException extends RuntimeException {

    public static final String INGESTION_DISABLED = "INGESTION_DISABLED";

    /** Batch id or session id the failure relates to, when known. */
    private final String entityId;
    private final String errorCode;

    public IngestionException(String message, String entityId, String errorCode) {
        this(message, entityId, errorCode, null);
    }

    public IngestionException(String message, String entityId, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public static IngestionException disabled() {
        return new IngestionException("Ingestion is disabled", null, INGESTION_DISABLED);
    }
}
