package com.outbreaksentinel.collectors.normalize;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Per-source normalization rules: static reliability prior, disease code aliases, reporting unit and
 * the age after which an observation is tagged stale.
 */
public record SourceProfile(
        String sourceId,
        double reliability,
        Map<String, String> diseaseAliases,
        ValueUnit valueUnit,
        Duration staleAfter
) {
    public static final double DEFAULT_RELIABILITY = 0.5;
    public static final Duration DEFAULT_STALE_AFTER = Duration.ofDays(14);

    public SourceProfile {
        Objects.requireNonNull(sourceId, "sourceId is required");
        if (!(reliability >= 0.0 && reliability <= 1.0)) {
            throw new IllegalArgumentException("reliability must be within [0, 1] for " + sourceId);
        }
        Map<String, String> aliases = new HashMap<>();
        if (diseaseAliases != null) {
            diseaseAliases.forEach((code, canonical) -> aliases.put(
                    code.trim().toLowerCase(Locale.ROOT),
                    canonical.trim().toLowerCase(Locale.ROOT)
            ));
        }
        diseaseAliases = Map.copyOf(aliases);
        valueUnit = valueUnit == null ? ValueUnit.COUNT : valueUnit;
        staleAfter = staleAfter == null ? DEFAULT_STALE_AFTER : staleAfter;
    }

    public static SourceProfile defaults(String sourceId) {
        return new SourceProfile(sourceId, DEFAULT_RELIABILITY, Map.of(), ValueUnit.COUNT, DEFAULT_STALE_AFTER);
    }

    public String canonicalDisease(String code) {
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return diseaseAliases.getOrDefault(normalized, normalized);
    }
}
