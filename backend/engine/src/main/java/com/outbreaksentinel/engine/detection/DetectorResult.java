package com.outbreaksentinel.engine.detection;

import com.outbreaksentinel.core.model.DetectionMethod;

import java.util.Objects;

public record DetectorResult(DetectionMethod method, Status status, DetectorSignal signal, String skipReason) {
    public static final String INSUFFICIENT_HISTORY = "insufficient_history";
    public static final String INSUFFICIENT_LOCATIONS = "insufficient_locations";

    public enum Status {
        FIRED,
        QUIET,
        SKIPPED
    }

    public DetectorResult {
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(status, "status is required");
        if ((status == Status.FIRED) != (signal != null)) {
            throw new IllegalArgumentException("a signal is present exactly when the detector fired");
        }
    }

    public static DetectorResult fired(DetectorSignal signal) {
        return new DetectorResult(signal.method(), Status.FIRED, signal, null);
    }

    public static DetectorResult quiet(DetectionMethod method) {
        return new DetectorResult(method, Status.QUIET, null, null);
    }

    public static DetectorResult skipped(DetectionMethod method, String reason) {
        return new DetectorResult(method, Status.SKIPPED, null, reason);
    }

    public boolean fired() {
        return status == Status.FIRED;
    }

    public boolean skipped() {
        return status == Status.SKIPPED;
    }
}
