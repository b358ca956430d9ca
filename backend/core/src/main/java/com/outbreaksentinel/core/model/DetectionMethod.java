package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.outbreaksentinel.core.error.InvalidMethodException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum DetectionMethod {
    CUSUM("cusum", "Cumulative sum control chart against a trailing baseline"),
    EWMA("ewma", "Exponentially weighted moving average control chart"),
    SPATIAL_SCAN("spatial_scan", "Kulldorff circular scan statistic with Monte Carlo significance"),
    SEASONAL_BASELINE("seasonal_baseline", "Residual against a trailing trend plus seasonal index forecast");

    private final String wireName;
    private final String description;

    DetectionMethod(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String description() {
        return description;
    }

    public static Set<DetectionMethod> all() {
        return EnumSet.allOf(DetectionMethod.class);
    }

    @JsonCreator
    public static DetectionMethod fromWireName(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DetectionMethod method : values()) {
                if (method.wireName.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new InvalidMethodException("detection", value);
    }
}
