package com.outbreaksentinel.engine.detection;

import com.outbreaksentinel.core.model.BucketRange;
import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;

/**
 * Two-sided EWMA chart. {@code z} starts at the first reference mean and follows
 * {@code z_t = λ·x_t + (1 − λ)·z_{t−1}}; the chart fires when the newest {@code z} leaves
 * {@code μ ± L·σ·sqrt(λ / (2 − λ))}.
 */
public class EwmaDetector implements Detector {
    @Override
    public DetectionMethod method() {
        return DetectionMethod.EWMA;
    }

    @Override
    public DetectorResult detect(DetectionInput input, EngineConfig.Detection settings) {
        double[] x = input.values();
        int first = settings.baselineHistory();
        int last = x.length - 1;
        if (last < first) {
            return DetectorResult.skipped(method(), DetectorResult.INSUFFICIENT_HISTORY);
        }

        double lambda = settings.ewmaLambda();
        double z = Baseline.at(x, first, settings.baselineWindow(), settings.guardBuckets(), settings.minStdDev()).mean();
        Baseline baseline = null;
        for (int t = first; t <= last; t++) {
            baseline = Baseline.at(x, t, settings.baselineWindow(), settings.guardBuckets(), settings.minStdDev());
            z = lambda * x[t] + (1.0 - lambda) * z;
        }

        double sigmaZ = baseline.stdDev() * Math.sqrt(lambda / (2.0 - lambda));
        double limit = settings.effectiveEwmaLimitSigma() * sigmaZ;
        double deviation = z - baseline.mean();
        if (Math.abs(deviation) <= limit) {
            return DetectorResult.quiet(method());
        }

        DetectorSignal.Direction direction = deviation > 0
                ? DetectorSignal.Direction.INCREASE
                : DetectorSignal.Direction.DECREASE;
        int start = last;
        while (start > first && Math.signum(x[start - 1] - baseline.mean()) == Math.signum(deviation)) {
            start--;
        }
        BucketRange window = new BucketRange(input.bucketAt(start), input.cell().timeBucket());
        return DetectorResult.fired(new DetectorSignal(
                method(),
                input.cell(),
                direction,
                Math.abs(deviation),
                limit,
                DetectorSignal.thresholdConfidence(Math.abs(deviation), limit),
                window,
                window.from(),
                baseline.growthRate(x[last]),
                null,
                null
        ));
    }
}
