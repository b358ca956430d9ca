package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceStatus {
    OK,
    STALE,
    MISSING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SourceStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return OK;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
