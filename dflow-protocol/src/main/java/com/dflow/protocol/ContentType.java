package com.dflow.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared kind of an {@link Envelope} body. The engine carries it along and never inspects it.
 */
public enum ContentType {
    RAW_TEXT,
    OBJECT,
    CONVERSATION_STATE,
    BINARY,
    UNKNOWN;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ContentType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (ContentType t : values()) {
            if (t.name().equals(normalized)) return t;
        }
        return UNKNOWN;
    }
}
