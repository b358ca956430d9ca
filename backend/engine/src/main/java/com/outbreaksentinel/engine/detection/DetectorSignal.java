package com.outbreaksentinel.engine.detection;

import com.outbreaksentinel.core.model.BucketRange;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.core.model.TimeBucket;

import java.util.List;
import java.util.Objects;

/**
 * One detector's finding for one cell.
 *
 * @param growthRate         relative excess of the current value over the baseline or forecast, when defined
 * @param affectedPopulation population of the implicated area, when the detector knows it
 * @param clusterRegions     regions of the implicated area, the cell's own region for temporal detectors
 */
public record DetectorSignal(
        DetectionMethod method,
        CellKey cell,
        Direction direction,
        double statistic,
        double threshold,
        double confidence,
        BucketRange window,
        TimeBucket estimatedStart,
        Double growthRate,
        Long affectedPopulation,
        List<String> clusterRegions
) {
    public enum Direction {
        INCREASE,
        DECREASE
    }

    public DetectorSignal {
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(cell, "cell is required");
        Objects.requireNonNull(direction, "direction is required");
        Objects.requireNonNull(window, "window is required");
        estimatedStart = estimatedStart == null ? window.from() : estimatedStart;
        clusterRegions = clusterRegions == null ? List.of(cell.region()) : List.copyOf(clusterRegions);
    }

    public boolean outbreak() {
        return direction == Direction.INCREASE;
    }

    /**
     * Confidence of a threshold crossing: {@code 1 − threshold / (2 · statistic)} clamped to [0.5, 0.99].
     */
    static double thresholdConfidence(double statistic, double threshold) {
        if (statistic <= 0.0) {
            return 0.5;
        }
        double confidence = 1.0 - threshold / (2.0 * statistic);
        return Math.max(0.5, Math.min(0.99, confidence));
    }
}
