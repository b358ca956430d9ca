package com.outbreaksentinel.core.model;

import java.util.Objects;

public record CellKey(String region, String disease, TimeBucket timeBucket) {
    public CellKey {
        SeriesKey normalized = new SeriesKey(region, disease);
        region = normalized.region();
        disease = normalized.disease();
        Objects.requireNonNull(timeBucket, "timeBucket is required");
    }

    public SeriesKey series() {
        return new SeriesKey(region, disease);
    }

    @Override
    public String toString() {
        return region + "/" + disease + "@" + timeBucket;
    }
}
