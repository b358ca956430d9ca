package com.outbreaksentinel.engine.quality;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.SourceEstimate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores each source on completeness, timeliness, consistency with the fused values and its
 * configured reliability, and blends them into an overall quality with a letter grade.
 */
public class SourceQualityAssessor {
    static final double COMPLETENESS_WEIGHT = 0.3;
    static final double TIMELINESS_WEIGHT = 0.25;
    static final double CONSISTENCY_WEIGHT = 0.25;
    static final double RELIABILITY_WEIGHT = 0.2;

    private final Clock clock;

    public SourceQualityAssessor(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param reliabilities  configured reliability per source id
     * @param estimates      everything the sources returned for the request, including missing sentinels
     * @param requestedCells number of cells the request asked each source for
     * @param fused          fused estimates to measure consistency against
     */
    public List<SourceQuality> assess(
            Map<String, Double> reliabilities,
            Collection<SourceEstimate> estimates,
            int requestedCells,
            Map<CellKey, FusedEstimate> fused
    ) {
        List<SourceQuality> qualities = new ArrayList<>();
        for (Map.Entry<String, Double> entry : reliabilities.entrySet()) {
            String sourceId = entry.getKey();
            List<SourceEstimate> usable = estimates.stream()
                    .filter(estimate -> estimate.sourceId().equals(sourceId) && estimate.usable())
                    .toList();
            double completeness = completeness(usable, requestedCells);
            double timeliness = timeliness(usable, clock.instant());
            double consistency = consistency(usable, fused);
            double reliability = entry.getValue() == null ? 0.0 : entry.getValue();
            double overall = COMPLETENESS_WEIGHT * completeness
                    + TIMELINESS_WEIGHT * timeliness
                    + CONSISTENCY_WEIGHT * consistency
                    + RELIABILITY_WEIGHT * reliability;
            qualities.add(new SourceQuality(sourceId, completeness, timeliness, consistency, reliability,
                    overall, grade(overall)));
        }
        return qualities;
    }

    public static String grade(double overall) {
        if (overall >= 0.9) {
            return "A";
        }
        if (overall >= 0.8) {
            return "B";
        }
        if (overall >= 0.7) {
            return "C";
        }
        if (overall >= 0.6) {
            return "D";
        }
        return "F";
    }

    private static double completeness(List<SourceEstimate> usable, int requestedCells) {
        if (requestedCells <= 0) {
            return 0.0;
        }
        Set<CellKey> covered = new HashSet<>();
        usable.forEach(estimate -> covered.add(estimate.cellKey()));
        return Math.min(1.0, covered.size() / (double) requestedCells);
    }

    private static double timeliness(List<SourceEstimate> usable, Instant now) {
        Instant newest = null;
        for (SourceEstimate estimate : usable) {
            if (newest == null || estimate.observedAt().isAfter(newest)) {
                newest = estimate.observedAt();
            }
        }
        if (newest == null) {
            return 0.0;
        }
        double ageHours = Math.max(0L, Duration.between(newest, now).toSeconds()) / 3600.0;
        return Math.exp(-ageHours / 24.0);
    }

    private static double consistency(List<SourceEstimate> usable, Map<CellKey, FusedEstimate> fused) {
        if (usable.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        int compared = 0;
        for (SourceEstimate estimate : usable) {
            FusedEstimate reference = fused.get(estimate.cellKey());
            if (reference == null) {
                continue;
            }
            double relativeDeviation = (estimate.value() - reference.mean()) / Math.max(Math.abs(reference.mean()), 1e-9);
            total += 1.0 / (1.0 + relativeDeviation * relativeDeviation);
            compared++;
        }
        return compared == 0 ? 1.0 : total / compared;
    }
}
