package com.outbreaksentinel.engine.fusion;

import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;

/**
 * Precision-weighted Gaussian fusion. Each source is a noisy observation of one latent value with
 * precision {@code τ = reliability / baselineVariance}; the mean is the posterior mean.
 *
 * <p>The reported variance deliberately differs from the textbook posterior variance {@code 1 / Σ τ}:
 * it is {@code (1 / Σ τ) / agreement}. The plain posterior ignores how far apart the source values
 * are, while the divided form grows with cross-source disagreement. The two are equal when every
 * source reports the same value, and for a single source.
 */
public class BayesianFusion implements FusionStrategy {
    @Override
    public FusionMethod method() {
        return FusionMethod.BAYESIAN;
    }

    @Override
    public FusionResult fuse(FusionInput input, EngineConfig.Fusion settings) {
        double[] values = input.values();
        double[] weights = input.weights();
        double posteriorPrecision = 0.0;
        double weightedSum = 0.0;
        for (int i = 0; i < values.length; i++) {
            double precision = weights[i] / settings.baselineVariance();
            posteriorPrecision += precision;
            weightedSum += precision * values[i];
        }
        double mean = weightedSum / posteriorPrecision;
        double agreement = FusionMath.agreement(values, weights, settings.baselineVariance());
        return new FusionResult(mean, (1.0 / posteriorPrecision) / agreement, agreement);
    }
}
