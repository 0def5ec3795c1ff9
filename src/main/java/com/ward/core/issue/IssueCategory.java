package com.ward.core.issue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueCategory {
    CACHING("caching"),
    WATERFALL("waterfall"),
    DATA_FETCHING("data-fetching"),
    RENDERING("rendering"),
    SERVER_ACTIONS("server-actions"),
    CONFIGURATION("configuration");

    private final String value;

    IssueCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static IssueCategory fromValue(String value) {
        for (IssueCategory category : values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown issue category: " + value);
    }
}
