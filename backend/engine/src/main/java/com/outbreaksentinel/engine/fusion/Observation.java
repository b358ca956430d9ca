package com.outbreaksentinel.engine.fusion;

import java.time.Instant;

/**
 * A usable source value prepared for fusion. {@code weight} is the source reliability after any
 * staleness discount and is always positive.
 */
public record Observation(String sourceId, double value, double weight, Instant observedAt) {
    public Observation {
        if (!(weight > 0.0 && weight <= 1.0)) {
            throw new IllegalArgumentException("observation weight must be within (0, 1]: " + weight);
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("observation value must be finite: " + value);
        }
    }
}
