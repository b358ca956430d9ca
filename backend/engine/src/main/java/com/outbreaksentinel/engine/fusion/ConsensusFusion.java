package com.outbreaksentinel.engine.fusion;

import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;

import java.util.List;

/**
 * Plain mean when the sources' relative range is tight, otherwise the median. Reliability does not
 * move the point estimate.
 */
public class ConsensusFusion implements FusionStrategy {
    static final String MEDIAN_USED = "consensus_median";

    @Override
    public FusionMethod method() {
        return FusionMethod.CONSENSUS;
    }

    @Override
    public FusionResult fuse(FusionInput input, EngineConfig.Fusion settings) {
        double[] values = input.values();
        int n = values.length;
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double mean = sum / n;
        double rangeAgreement = rangeAgreement(min, max, mean);
        boolean useMean = rangeAgreement > settings.consensusAgreement();
        double estimate = useMean ? mean : FusionMath.median(values);

        double sampleVariance = 0.0;
        if (n > 1) {
            for (double value : values) {
                sampleVariance += (value - mean) * (value - mean);
            }
            sampleVariance /= (n - 1);
        }
        return new FusionResult(
                estimate,
                sampleVariance / n,
                FusionMath.agreement(values, input.weights(), settings.baselineVariance()),
                useMean ? List.of() : List.of(MEDIAN_USED)
        );
    }

    static double rangeAgreement(double min, double max, double mean) {
        double range = max - min;
        if (range == 0.0) {
            return 1.0;
        }
        if (mean == 0.0) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - range / Math.abs(mean));
    }
}
