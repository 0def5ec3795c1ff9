package com.ward.core.span;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the browser arrived at a page.
 */
public enum NavigationType {
    INITIAL("initial"),
    NAVIGATION("navigation"),
    BACK_FORWARD("back-forward");

    private final String value;

    NavigationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Client-side transitions that reuse the already loaded document.
     */
    public boolean isSoftNavigation() {
        return this == NAVIGATION || this == BACK_FORWARD;
    }

    @JsonCreator
    public static NavigationType fromValue(String value) {
        for (NavigationType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown navigation type: " + value);
    }
}
