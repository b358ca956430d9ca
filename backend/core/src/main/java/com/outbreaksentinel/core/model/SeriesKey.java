package com.outbreaksentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * One monitored time series: a (region, disease) pair across buckets.
 */
public record SeriesKey(String region, String disease) {
    public SeriesKey {
        Objects.requireNonNull(region, "region is required");
        Objects.requireNonNull(disease, "disease is required");
        region = region.trim();
        disease = disease.trim().toLowerCase(Locale.ROOT);
    }

    public CellKey at(TimeBucket bucket) {
        return new CellKey(region, disease, bucket);
    }

    @Override
    public String toString() {
        return region + "/" + disease;
    }
}
