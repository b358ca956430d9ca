package com.outbreaksentinel.engine.detection;

import com.outbreaksentinel.core.model.RegionProfile;

import java.util.Objects;

/**
 * Case count of one located region for the bucket under test.
 */
public record SpatialCell(RegionProfile region, double cases) {
    public SpatialCell {
        Objects.requireNonNull(region, "region is required");
        if (!(cases >= 0.0) || Double.isInfinite(cases)) {
            throw new IllegalArgumentException("cases must be finite and >= 0 for " + region.region());
        }
    }
}
