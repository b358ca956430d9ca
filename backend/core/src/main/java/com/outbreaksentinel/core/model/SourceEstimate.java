package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Objects;

/**
 * One source's claim for one cell. A {@code missing} estimate carries no value and only records that
 * the source was asked and failed.
 */
public record SourceEstimate(
        String sourceId,
        String region,
        String disease,
        TimeBucket timeBucket,
        double value,
        double reliability,
        Instant observedAt,
        SourceStatus status
) {
    public SourceEstimate {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(timeBucket, "timeBucket is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        CellKey key = new CellKey(region, disease, timeBucket);
        region = key.region();
        disease = key.disease();
        status = status == null ? SourceStatus.OK : status;
        if (!(reliability >= 0.0 && reliability <= 1.0)) {
            throw new IllegalArgumentException("reliability must be within [0, 1]: " + reliability);
        }
        if (status != SourceStatus.MISSING && !Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite for " + status + " estimate from " + sourceId);
        }
    }

    public static SourceEstimate missing(String sourceId, CellKey cellKey, double reliability, Instant observedAt) {
        return new SourceEstimate(
                sourceId,
                cellKey.region(),
                cellKey.disease(),
                cellKey.timeBucket(),
                Double.NaN,
                reliability,
                observedAt,
                SourceStatus.MISSING
        );
    }

    @JsonIgnore
    public boolean usable() {
        return status != SourceStatus.MISSING;
    }

    @JsonIgnore
    public CellKey cellKey() {
        return new CellKey(region, disease, timeBucket);
    }

    public SourceEstimate withStatus(SourceStatus newStatus) {
        return new SourceEstimate(sourceId, region, disease, timeBucket, value, reliability, observedAt, newStatus);
    }
}
