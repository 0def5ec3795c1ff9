package com.ward.core.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What kind of work a resource represents within a page session.
 */
public enum ResourceType {
    DOCUMENT("document"),
    FETCH("fetch"),
    API("api"),
    DATABASE("database"),
    EXTERNAL("external"),
    RSC("rsc"),
    ACTION("action"),
    RENDER("render"),
    HYDRATION("hydration"),
    CACHE("cache"),
    OTHER("other");

    private final String value;

    ResourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ResourceType fromValue(String value) {
        for (ResourceType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown resource type: " + value);
    }
}
