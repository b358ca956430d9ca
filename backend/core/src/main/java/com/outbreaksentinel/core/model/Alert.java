package com.outbreaksentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

public record Alert(
        String id,
        String region,
        String disease,
        Instant detectedAt,
        TimeBucket detectedBucket,
        BucketRange window,
        Set<DetectionMethod> methods,
        Severity severity,
        double confidence,
        TimeBucket estimatedStart,
        Double growthRate,
        Long affectedPopulation
) {
    public Alert {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(detectedAt, "detectedAt is required");
        Objects.requireNonNull(detectedBucket, "detectedBucket is required");
        Objects.requireNonNull(window, "window is required");
        Objects.requireNonNull(severity, "severity is required");
        SeriesKey key = new SeriesKey(region, disease);
        region = key.region();
        disease = key.disease();
        if (methods == null || methods.isEmpty()) {
            throw new IllegalArgumentException("an alert needs at least one detection method");
        }
        methods = Collections.unmodifiableSet(new TreeSet<>(methods));
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        estimatedStart = estimatedStart == null ? window.from() : estimatedStart;
    }

    public SeriesKey seriesKey() {
        return new SeriesKey(region, disease);
    }
}
