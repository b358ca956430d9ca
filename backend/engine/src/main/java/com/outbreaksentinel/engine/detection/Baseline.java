package com.outbreaksentinel.engine.detection;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Mean and standard deviation of a trailing reference window, the deviation floored at a minimum.
 */
record Baseline(double mean, double stdDev) {
    /**
     * Reference window for time index {@code t}: the {@code window} values ending {@code guard}
     * positions before {@code t}.
     */
    static Baseline at(double[] values, int t, int window, int guard, double minStdDev) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        int end = t - guard;
        for (int i = end - window; i < end; i++) {
            stats.addValue(values[i]);
        }
        double sd = stats.getN() > 1 ? stats.getStandardDeviation() : 0.0;
        return new Baseline(stats.getMean(), Math.max(minStdDev, sd));
    }

    Double growthRate(double value) {
        return mean > 0 ? (value - mean) / mean : null;
    }
}
