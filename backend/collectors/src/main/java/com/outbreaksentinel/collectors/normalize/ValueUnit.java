package com.outbreaksentinel.collectors.normalize;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ValueUnit {
    COUNT("count"),
    RATE_PER_100K("rate_per_100k");

    private final String wireName;

    ValueUnit(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ValueUnit fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return COUNT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ValueUnit unit : values()) {
            if (unit.wireName.equals(normalized)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown value unit: " + value);
    }
}
