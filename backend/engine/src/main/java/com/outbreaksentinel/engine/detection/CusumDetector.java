package com.outbreaksentinel.engine.detection;

import com.outbreaksentinel.core.model.BucketRange;
import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;

/**
 * Upper one-sided CUSUM, {@code S_t = max(0, S_{t-1} + x_t − μ_t − k)}, with {@code μ_t} and {@code σ_t}
 * taken from the reference window ending {@code guardBuckets} before {@code t}, {@code k = slack·σ_t}
 * and {@code h = threshold·σ_t}. The statistic is rebuilt from the start of the supplied series on
 * every call and reset to zero after each crossing; only a crossing at the newest bucket fires.
 */
public class CusumDetector implements Detector {
    @Override
    public DetectionMethod method() {
        return DetectionMethod.CUSUM;
    }

    @Override
    public DetectorResult detect(DetectionInput input, EngineConfig.Detection settings) {
        double[] x = input.values();
        int first = settings.baselineHistory();
        int last = x.length - 1;
        if (last < first) {
            return DetectorResult.skipped(method(), DetectorResult.INSUFFICIENT_HISTORY);
        }

        double s = 0.0;
        int runStart = first;
        boolean firedAtLast = false;
        double threshold = 0.0;
        Baseline baseline = null;
        for (int t = first; t <= last; t++) {
            baseline = Baseline.at(x, t, settings.baselineWindow(), settings.guardBuckets(), settings.minStdDev());
            double slack = settings.cusumSlackSigma() * baseline.stdDev();
            threshold = settings.effectiveCusumThresholdSigma() * baseline.stdDev();
            if (s == 0.0) {
                runStart = t;
            }
            s = Math.max(0.0, s + x[t] - baseline.mean() - slack);
            if (s > threshold) {
                if (t == last) {
                    firedAtLast = true;
                } else {
                    s = 0.0;
                }
            }
        }
        if (!firedAtLast) {
            return DetectorResult.quiet(method());
        }

        BucketRange window = new BucketRange(input.bucketAt(runStart), input.cell().timeBucket());
        return DetectorResult.fired(new DetectorSignal(
                method(),
                input.cell(),
                DetectorSignal.Direction.INCREASE,
                s,
                threshold,
                DetectorSignal.thresholdConfidence(s, threshold),
                window,
                window.from(),
                baseline.growthRate(x[last]),
                null,
                null
        ));
    }
}
