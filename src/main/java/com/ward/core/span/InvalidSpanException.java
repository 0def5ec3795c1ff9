package com.ward.core.span;

/**
 * Thrown when an incoming span lacks the fields needed to place it in a session.
 */
public class InvalidSpanException extends RuntimeException {

    private final String spanId;

    public InvalidSpanException(String message, String spanId) {
        super(message);
        this.spanId = spanId;
    }

    public String getSpanId() {
        return spanId;
    }
}
