package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LOW(0.25),
    MODERATE(0.5),
    HIGH(0.75);

    private final double riskWeight;

    Severity(double riskWeight) {
        this.riskWeight = riskWeight;
    }

    public double riskWeight() {
        return riskWeight;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
