package com.example.trafficservice.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Tags of the inferred-schema union.
 */
public enum SchemaKind {
    ABSENT,
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT,
    UNKNOWN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SchemaKind fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Absent and null widen any other kind without making it a conflict.
     */
    public boolean isConcrete() {
        return this != ABSENT && this != NULL;
    }
}
