package com.outbreaksentinel.engine.fusion;

import java.util.Arrays;

final class FusionMath {
    private FusionMath() {
    }

    static double weightedMean(double[] values, double[] weights) {
        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < values.length; i++) {
            numerator += weights[i] * values[i];
            denominator += weights[i];
        }
        return numerator / denominator;
    }

    static double weightedVariance(double[] values, double[] weights, double around) {
        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < values.length; i++) {
            double deviation = values[i] - around;
            numerator += weights[i] * deviation * deviation;
            denominator += weights[i];
        }
        return numerator / denominator;
    }

    /**
     * {@code 1 / (1 + s² / baselineVariance)} where {@code s²} is the reliability-weighted variance of
     * the raw values. Exactly 1 for identical values and strictly decreasing in {@code s²}, independent
     * of the magnitude of the values.
     */
    static double agreement(double[] values, double[] weights, double baselineVariance) {
        if (values.length < 2) {
            return 1.0;
        }
        double dispersion = weightedVariance(values, weights, weightedMean(values, weights));
        if (dispersion == 0.0) {
            return 1.0;
        }
        return 1.0 / (1.0 + dispersion / baselineVariance);
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2.0 : sorted[mid];
    }
}
