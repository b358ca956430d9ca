package com.outbreaksentinel.engine.fusion;

import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;

public class WeightedAverageFusion implements FusionStrategy {
    @Override
    public FusionMethod method() {
        return FusionMethod.WEIGHTED_AVERAGE;
    }

    @Override
    public FusionResult fuse(FusionInput input, EngineConfig.Fusion settings) {
        double[] values = input.values();
        double[] weights = input.weights();
        double mean = FusionMath.weightedMean(values, weights);
        double variance = FusionMath.weightedVariance(values, weights, mean);
        return new FusionResult(mean, variance, FusionMath.agreement(values, weights, settings.baselineVariance()));
    }
}
