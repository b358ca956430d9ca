package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.outbreaksentinel.core.error.InvalidMethodException;

import java.util.Locale;

/**
 * Qualitative detection knob. {@code thresholdScale} multiplies decision thresholds, {@code scanAlpha}
 * replaces the spatial scan significance level.
 */
public enum Sensitivity {
    LOW(1.25, 0.01),
    MEDIUM(1.0, 0.05),
    HIGH(0.8, 0.10);

    private final double thresholdScale;
    private final double scanAlpha;

    Sensitivity(double thresholdScale, double scanAlpha) {
        this.thresholdScale = thresholdScale;
        this.scanAlpha = scanAlpha;
    }

    public double thresholdScale() {
        return thresholdScale;
    }

    public double scanAlpha() {
        return scanAlpha;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Sensitivity fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        for (Sensitivity sensitivity : values()) {
            if (sensitivity.wireName().equalsIgnoreCase(value.trim())) {
                return sensitivity;
            }
        }
        throw new InvalidMethodException("sensitivity", value);
    }
}
