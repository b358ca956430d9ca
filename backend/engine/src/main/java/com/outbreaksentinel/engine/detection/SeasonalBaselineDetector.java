package com.outbreaksentinel.engine.detection;

import com.outbreaksentinel.core.model.BucketRange;
import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Forecasts the newest bucket from the trailing {@code period × cycles} buckets as a least-squares
 * trend plus a per-phase seasonal index, and fires when the observation misses the forecast by more
 * than {@code L} residual standard deviations.
 */
public class SeasonalBaselineDetector implements Detector {
    @Override
    public DetectionMethod method() {
        return DetectionMethod.SEASONAL_BASELINE;
    }

    @Override
    public DetectorResult detect(DetectionInput input, EngineConfig.Detection settings) {
        double[] x = input.values();
        int period = settings.seasonalPeriod();
        int window = settings.seasonalWindow();
        int last = x.length - 1;
        if (last < window) {
            return DetectorResult.skipped(method(), DetectorResult.INSUFFICIENT_HISTORY);
        }

        int offset = last - window;
        SimpleRegression trend = new SimpleRegression();
        for (int t = 0; t < window; t++) {
            trend.addData(t, x[offset + t]);
        }
        double[] phaseSum = new double[period];
        int[] phaseCount = new int[period];
        for (int t = 0; t < window; t++) {
            double residual = x[offset + t] - trend.predict(t);
            phaseSum[t % period] += residual;
            phaseCount[t % period]++;
        }
        double[] seasonalIndex = new double[period];
        for (int p = 0; p < period; p++) {
            seasonalIndex[p] = phaseCount[p] == 0 ? 0.0 : phaseSum[p] / phaseCount[p];
        }
        DescriptiveStatistics residuals = new DescriptiveStatistics();
        for (int t = 0; t < window; t++) {
            residuals.addValue(x[offset + t] - (trend.predict(t) + seasonalIndex[t % period]));
        }
        double residualStdDev = Math.max(settings.minStdDev(), residuals.getStandardDeviation());

        double forecast = trend.predict(window) + seasonalIndex[window % period];
        double deviation = x[last] - forecast;
        double threshold = settings.effectiveSeasonalThresholdSigma() * residualStdDev;
        if (Math.abs(deviation) <= threshold) {
            return DetectorResult.quiet(method());
        }

        BucketRange range = BucketRange.single(input.cell().timeBucket());
        return DetectorResult.fired(new DetectorSignal(
                method(),
                input.cell(),
                deviation > 0 ? DetectorSignal.Direction.INCREASE : DetectorSignal.Direction.DECREASE,
                Math.abs(deviation),
                threshold,
                DetectorSignal.thresholdConfidence(Math.abs(deviation), threshold),
                range,
                range.from(),
                forecast > 0 ? deviation / forecast : null,
                null,
                null
        ));
    }
}
