package com.outbreaksentinel.engine.quality;

import com.outbreaksentinel.core.model.FusedEstimate;

import java.util.Collection;

/**
 * Overall confidence in a fusion response, blending source quality, source agreement, the number of
 * contributing sources and the relative standard error of the fused values.
 */
public final class ConfidenceScore {
    private ConfidenceScore() {
    }

    public static double of(Collection<SourceQuality> qualities, Collection<FusedEstimate> fused, int sourceCount) {
        double quality = qualities.stream().mapToDouble(SourceQuality::overallQuality).average().orElse(0.0);
        double agreement = fused.stream().mapToDouble(FusedEstimate::agreementScore).average().orElse(0.0);
        double coverage = Math.min(1.0, sourceCount / 5.0);
        double relativeError = fused.stream()
                .mapToDouble(estimate -> estimate.standardDeviation() / Math.max(Math.abs(estimate.mean()), 1e-9))
                .average()
                .orElse(1.0);
        double precision = 1.0 - Math.max(0.0, Math.min(1.0, relativeError));
        return 0.3 * quality + 0.25 * agreement + 0.15 * coverage + 0.3 * precision;
    }
}
