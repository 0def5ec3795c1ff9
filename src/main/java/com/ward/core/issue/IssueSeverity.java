package com.ward.core.issue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How urgent a detected issue is. Lower rank is more severe.
 */
public enum IssueSeverity {
    CRITICAL(0),
    WARNING(1),
    INFO(2),
    OPTIMIZATION(3);

    private final int rank;

    IssueSeverity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * True when this severity is at least as severe as {@code minimum}.
     */
    public boolean isAtLeast(IssueSeverity minimum) {
        return rank <= minimum.rank;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IssueSeverity fromValue(String value) {
        for (IssueSeverity severity : values()) {
            if (severity.getValue().equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown issue severity: " + value);
    }
}
