package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reconciled value for one cell. Superseded, never mutated, by later estimates for the same bucket.
 */
public record FusedEstimate(
        String region,
        String disease,
        TimeBucket timeBucket,
        double mean,
        double variance,
        FusionMethod method,
        Set<String> sourcesUsed,
        Set<String> sourcesFailed,
        double agreementScore,
        Instant computedAt,
        List<String> warnings
) {
    public static final String CARRIED_FORWARD = "carried_forward";
    public static final String CONFLICTING_EVIDENCE = "conflicting_evidence";

    public FusedEstimate {
        CellKey key = new CellKey(region, disease, timeBucket);
        region = key.region();
        disease = key.disease();
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(computedAt, "computedAt is required");
        if (!Double.isFinite(mean)) {
            throw new IllegalArgumentException("mean must be finite for " + key);
        }
        if (!(variance >= 0.0) || Double.isInfinite(variance)) {
            throw new IllegalArgumentException("variance must be finite and >= 0 for " + key + ": " + variance);
        }
        if (!(agreementScore >= 0.0 && agreementScore <= 1.0)) {
            throw new IllegalArgumentException("agreementScore must be within [0, 1]: " + agreementScore);
        }
        sourcesUsed = sorted(sourcesUsed);
        sourcesFailed = sorted(sourcesFailed);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @JsonIgnore
    public CellKey cellKey() {
        return new CellKey(region, disease, timeBucket);
    }

    @JsonIgnore
    public SeriesKey seriesKey() {
        return new SeriesKey(region, disease);
    }

    /**
     * Copy of this estimate moved to {@code bucket} with no contributing sources, used when a cell
     * has no fresh data but a prior value exists.
     */
    public FusedEstimate carriedForwardTo(TimeBucket bucket, Set<String> failed, Instant at) {
        List<String> notes = new ArrayList<>(warnings);
        if (!notes.contains(CARRIED_FORWARD)) {
            notes.add(CARRIED_FORWARD);
        }
        return new FusedEstimate(region, disease, bucket, mean, variance, method, Set.of(), failed, 0.0, at, notes);
    }

    @JsonIgnore
    public double standardDeviation() {
        return Math.sqrt(variance);
    }

    private static Set<String> sorted(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new TreeSet<>(values));
    }
}
