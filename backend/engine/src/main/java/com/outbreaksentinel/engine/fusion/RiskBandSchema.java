package com.outbreaksentinel.engine.fusion;

/**
 * Ordinal incidence bands used by belief fusion: values below {@code lowUpperBound} are low, below
 * {@code moderateUpperBound} moderate, anything else high.
 */
public record RiskBandSchema(double lowUpperBound, double moderateUpperBound) {
    public static final RiskBandSchema DEFAULT = new RiskBandSchema(50.0, 150.0);

    public enum Band {
        LOW,
        MODERATE,
        HIGH
    }

    public RiskBandSchema {
        if (!(lowUpperBound > 0 && moderateUpperBound > lowUpperBound)) {
            throw new IllegalArgumentException(
                    "risk bands need 0 < low < moderate, got " + lowUpperBound + " / " + moderateUpperBound);
        }
    }

    public Band bandOf(double value) {
        if (value < lowUpperBound) {
            return Band.LOW;
        }
        if (value < moderateUpperBound) {
            return Band.MODERATE;
        }
        return Band.HIGH;
    }
}
