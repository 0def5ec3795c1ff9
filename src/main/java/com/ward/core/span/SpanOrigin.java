package com.ward.core.span;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Runtime that emitted a span.
 */
public enum SpanOrigin {
    CLIENT("client"),
    SERVER("server");

    private final String value;

    SpanOrigin(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SpanOrigin fromValue(String value) {
        for (SpanOrigin origin : values()) {
            if (origin.value.equalsIgnoreCase(value)) {
                return origin;
            }
        }
        throw new IllegalArgumentException("Unknown span origin: " + value);
    }
}
