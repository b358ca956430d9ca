package com.outbreaksentinel.core.model;

import java.util.Objects;

/**
 * Geographic reference data for one region code: centroid and population.
 */
public record RegionProfile(String region, double latitude, double longitude, long population) {
    private static final double EARTH_RADIUS_KM = 6371.0088;

    public RegionProfile {
        Objects.requireNonNull(region, "region is required");
        region = region.trim();
        if (population < 0) {
            throw new IllegalArgumentException("population must be >= 0 for " + region);
        }
    }

    /**
     * Great-circle distance between the two centroids.
     */
    public double distanceKm(RegionProfile other) {
        double lat1 = Math.toRadians(latitude);
        double lat2 = Math.toRadians(other.latitude);
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(other.longitude - longitude);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(a)));
    }
}
