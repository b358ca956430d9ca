package com.outbreaksentinel.engine.fusion;

import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;

import java.util.List;

/**
 * Scalar Kalman filter over the bucket sequence. The previous bucket's fused estimate is propagated
 * by the predict step ({@code mean + trend}, {@code variance + processNoise} per elapsed bucket) and
 * each observation is then applied in {@code observedAt} order as a scalar update with observation
 * variance {@code baselineVariance / reliability}.
 *
 * <p>Without a prior the filter starts from the first observation, which makes the result identical
 * to {@link BayesianFusion}.
 */
public class KalmanFilterFusion implements FusionStrategy {
    static final String NO_PRIOR = "kalman_no_prior";

    @Override
    public FusionMethod method() {
        return FusionMethod.KALMAN_FILTER;
    }

    @Override
    public FusionResult fuse(FusionInput input, EngineConfig.Fusion settings) {
        List<Observation> observations = input.observations();
        FusedEstimate prior = input.prior();
        double mean;
        double variance;
        int first;
        if (prior == null) {
            mean = observations.get(0).value();
            variance = observationVariance(observations.get(0), settings);
            first = 1;
        } else {
            long steps = prior.timeBucket().bucketsUntil(input.cell().timeBucket());
            mean = prior.mean() + steps * settings.trend();
            variance = prior.variance() + steps * settings.processNoise();
            first = 0;
        }
        for (int i = first; i < observations.size(); i++) {
            Observation observation = observations.get(i);
            double gain = variance / (variance + observationVariance(observation, settings));
            mean += gain * (observation.value() - mean);
            variance *= (1.0 - gain);
        }

        double agreement = FusionMath.agreement(input.values(), input.weights(), settings.baselineVariance());
        if (prior == null) {
            return new FusionResult(mean, variance / agreement, agreement, List.of(NO_PRIOR));
        }
        return new FusionResult(mean, variance, agreement);
    }

    private static double observationVariance(Observation observation, EngineConfig.Fusion settings) {
        return settings.baselineVariance() / observation.weight();
    }
}
