package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.outbreaksentinel.core.error.InvalidMethodException;

import java.util.List;
import java.util.Locale;

/**
 * Closed set of fusion algorithms. Callers select one per request by its wire name; {@link #BAYESIAN} is the default.
 */
public enum FusionMethod {
    WEIGHTED_AVERAGE("weighted_average", "Reliability-weighted mean with weighted sample variance"),
    BAYESIAN("bayesian", "Precision-weighted Gaussian posterior over one latent value", "bayesian_fusion"),
    KALMAN_FILTER("kalman_filter", "Scalar Kalman predict/update seeded from the previous bucket"),
    DEMPSTER_SHAFER("dempster_shafer", "Belief combination over ordinal risk bands"),
    ENSEMBLE("ensemble", "Average of weighted_average and bayesian, conservative variance", "ensemble_fusion"),
    CONSENSUS("consensus", "Mean when sources agree, median otherwise", "consensus_fusion");

    public static final FusionMethod DEFAULT = BAYESIAN;

    private final String wireName;
    private final String description;
    private final List<String> aliases;

    FusionMethod(String wireName, String description, String... aliases) {
        this.wireName = wireName;
        this.description = description;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String description() {
        return description;
    }

    @JsonCreator
    public static FusionMethod fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (FusionMethod method : values()) {
            if (method.wireName.equals(normalized) || method.aliases.contains(normalized)) {
                return method;
            }
        }
        throw new InvalidMethodException("fusion", value);
    }
}
