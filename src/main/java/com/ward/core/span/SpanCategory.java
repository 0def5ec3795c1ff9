package com.ward.core.span;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Coarse classification of the work a span represents.
 */
public enum SpanCategory {
    HTTP("http"),
    RENDER("render"),
    HYDRATION("hydration"),
    DATABASE("database"),
    CACHE("cache"),
    EXTERNAL("external"),
    MIDDLEWARE("middleware"),
    OTHER("other");

    private final String value;

    SpanCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Looks up a category by its exact wire value.
     *
     * @param value the wire value, may be null
     * @return the category, or empty when the value is not a known category
     */
    public static Optional<SpanCategory> lookup(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (SpanCategory category : values()) {
            if (category.value.equals(value)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static SpanCategory fromValue(String value) {
        return lookup(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown span category: " + value));
    }
}
