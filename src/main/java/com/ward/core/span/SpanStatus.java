package com.ward.core.span;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Completion status of a span.
 */
public enum SpanStatus {
    OK("ok"),
    ERROR("error"),
    UNSET("unset");

    private final String value;

    SpanStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SpanStatus fromValue(String value) {
        if (value == null) {
            return UNSET;
        }
        for (SpanStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown span status: " + value);
    }
}
