package com.outbreaksentinel.engine.alert;

import com.outbreaksentinel.core.model.Alert;

import java.util.Optional;

/**
 * Result of one aggregation: a new alert, a suppression by an open alert, or nothing.
 */
public record AggregationOutcome(Alert alert, Alert suppressedBy) {
    private static final AggregationOutcome NONE = new AggregationOutcome(null, null);

    public static AggregationOutcome none() {
        return NONE;
    }

    public static AggregationOutcome emitted(Alert alert) {
        return new AggregationOutcome(alert, null);
    }

    public static AggregationOutcome suppressed(Alert openAlert) {
        return new AggregationOutcome(null, openAlert);
    }

    public Optional<Alert> emittedAlert() {
        return Optional.ofNullable(alert);
    }

    public boolean suppressed() {
        return suppressedBy != null;
    }
}
