package com.outbreaksentinel.engine.fusion;

import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Equal blend of weighted-average and bayesian means with the larger of the two variances.
 */
public class EnsembleFusion implements FusionStrategy {
    private final WeightedAverageFusion weightedAverage = new WeightedAverageFusion();
    private final BayesianFusion bayesian = new BayesianFusion();

    @Override
    public FusionMethod method() {
        return FusionMethod.ENSEMBLE;
    }

    @Override
    public FusionResult fuse(FusionInput input, EngineConfig.Fusion settings) {
        FusionResult wa = weightedAverage.fuse(input, settings);
        FusionResult bayes = bayesian.fuse(input, settings);
        double mean = 0.5 * wa.mean() + 0.5 * bayes.mean();
        List<String> warnings = new ArrayList<>(wa.warnings());
        warnings.addAll(bayes.warnings());
        return new FusionResult(
                mean,
                Math.max(wa.variance(), bayes.variance()),
                FusionMath.agreement(input.values(), input.weights(), settings.baselineVariance()),
                warnings
        );
    }
}
