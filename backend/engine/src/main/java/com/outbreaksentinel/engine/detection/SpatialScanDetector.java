package com.outbreaksentinel.engine.detection;

import com.outbreaksentinel.core.model.BucketRange;
import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fires for a cell when the most likely cluster of its disease in the current bucket is significant
 * and contains the cell's region. The Monte Carlo seed is derived from the configured seed, the
 * disease and the bucket, so a rerun over the same counts yields the same p-value. Scan results are
 * memoized per input since every region of a bucket asks the same question.
 */
public class SpatialScanDetector implements Detector {
    public static final int MIN_LOCATIONS = 3;
    private static final int CACHE_LIMIT = 256;

    private final Map<ScanKey, SpatialScan.Cluster> cache = new ConcurrentHashMap<>();

    @Override
    public DetectionMethod method() {
        return DetectionMethod.SPATIAL_SCAN;
    }

    @Override
    public DetectorResult detect(DetectionInput input, EngineConfig.Detection settings) {
        List<SpatialCell> spatial = input.spatial();
        boolean located = spatial.stream().anyMatch(cell -> cell.region().region().equals(input.cell().region()));
        if (spatial.size() < MIN_LOCATIONS || !located) {
            return DetectorResult.skipped(method(), DetectorResult.INSUFFICIENT_LOCATIONS);
        }

        long seed = settings.scanSeed() ^ (input.cell().disease() + "@" + input.cell().timeBucket()).hashCode();
        ScanKey key = new ScanKey(spatial, settings.scanPermutations(), settings.scanMaxPopulationFraction(), seed);
        if (cache.size() > CACHE_LIMIT) {
            cache.clear();
        }
        SpatialScan.Cluster cluster = cache.computeIfAbsent(key, k -> SpatialScan.scan(
                k.cells(), k.permutations(), k.maxPopulationFraction(), k.seed()));

        double alpha = settings.effectiveScanAlpha();
        if (!cluster.significant(alpha) || !cluster.regions().contains(input.cell().region())) {
            return DetectorResult.quiet(method());
        }
        BucketRange window = BucketRange.single(input.cell().timeBucket());
        return DetectorResult.fired(new DetectorSignal(
                method(),
                input.cell(),
                DetectorSignal.Direction.INCREASE,
                cluster.logLikelihoodRatio(),
                alpha,
                1.0 - cluster.pValue(),
                window,
                window.from(),
                cluster.expected() > 0 ? (cluster.observed() - cluster.expected()) / cluster.expected() : null,
                cluster.population(),
                cluster.regions()
        ));
    }

    private record ScanKey(List<SpatialCell> cells, int permutations, double maxPopulationFraction, long seed) {
    }
}
