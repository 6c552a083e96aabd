package com.example.trafficservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Exchange attribute a {@link FilterRule} pattern is matched against.
 */
public enum FilterRuleType {

    URL("url"),
    HOST("host"),
    CONTENT_TYPE("content-type"),
    METHOD("method"),

    /**
     * Every request header rendered as {@code Name: value}.
     */
    HEADER("header");

    private final String value;

    FilterRuleType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Accepts the wire value ({@code content-type}) as well as the constant name
     * ({@code CONTENT_TYPE}) and the underscore spelling used by older rule files.
     */
    @JsonCreator
    public static FilterRuleType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().replace('_', '-');
        return Arrays.stream(values())
            .filter(type -> type.value.equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown filter rule type: " + value));
    }

    @Override
    public String toString() {
        return value;
    }
}
