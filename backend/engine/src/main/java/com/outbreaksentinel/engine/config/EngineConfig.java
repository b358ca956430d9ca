package com.outbreaksentinel.engine.config;

import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.core.model.Sensitivity;
import com.outbreaksentinel.engine.fusion.RiskBandSchema;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable engine settings, passed explicitly to the fusion engine, store, detectors and aggregator.
 * Every section tolerates missing JSON fields: zero or null values fall back to the defaults below.
 */
public record EngineConfig(Fusion fusion, Store store, Detection detection, Alerting alerting, Workers workers) {
    public EngineConfig {
        fusion = fusion == null ? Fusion.defaults() : fusion;
        store = store == null ? Store.defaults() : store;
        detection = detection == null ? Detection.defaults() : detection;
        alerting = alerting == null ? Alerting.defaults() : alerting;
        workers = workers == null ? Workers.defaults() : workers;
    }

    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null, null, null);
    }

    public EngineConfig withSensitivity(Sensitivity sensitivity) {
        return new EngineConfig(fusion, store, detection.withSensitivity(sensitivity), alerting, workers);
    }

    public EngineConfig withDetectionMethods(Set<DetectionMethod> methods) {
        return new EngineConfig(fusion, store, detection.withEnabledMethods(methods), alerting, workers);
    }

    /**
     * @param baselineVariance      observation variance of a fully reliable source
     * @param processNoise          variance added per bucket by the Kalman predict step
     * @param trend                 drift added to the prior mean by the Kalman predict step
     * @param conflictCeiling       belief conflict at or above which evidence counts as contradictory
     * @param consensusAgreement    range agreement above which consensus fusion uses the mean
     */
    public record Fusion(
            FusionMethod defaultMethod,
            double baselineVariance,
            double processNoise,
            double trend,
            double staleReliabilityFactor,
            double conflictCeiling,
            double consensusAgreement,
            RiskBandSchema riskBands,
            Map<String, RiskBandSchema> riskBandsByDisease
    ) {
        public Fusion {
            defaultMethod = defaultMethod == null ? FusionMethod.DEFAULT : defaultMethod;
            baselineVariance = baselineVariance <= 0 ? 100.0 : baselineVariance;
            processNoise = Math.max(0.0, processNoise);
            staleReliabilityFactor = staleReliabilityFactor <= 0 ? 0.5 : Math.min(1.0, staleReliabilityFactor);
            conflictCeiling = conflictCeiling <= 0 ? 0.99 : Math.min(1.0, conflictCeiling);
            consensusAgreement = consensusAgreement <= 0 ? 0.8 : consensusAgreement;
            riskBands = riskBands == null ? RiskBandSchema.DEFAULT : riskBands;
            riskBandsByDisease = riskBandsByDisease == null ? Map.of() : Map.copyOf(riskBandsByDisease);
        }

        public static Fusion defaults() {
            return new Fusion(null, 0, 0, 0, 0, 0, 0, null, null);
        }

        public RiskBandSchema bandsFor(String disease) {
            return riskBandsByDisease.getOrDefault(disease, riskBands);
        }
    }

    public record Store(int retentionBuckets) {
        public Store {
            retentionBuckets = retentionBuckets <= 0 ? 90 : retentionBuckets;
        }

        public static Store defaults() {
            return new Store(0);
        }
    }

    /**
     * Detector thresholds at medium sensitivity. The {@code effective*} accessors apply the
     * configured {@link Sensitivity}.
     *
     * @param guardBuckets buckets between the baseline window and the bucket under test; {@code null}
     *                     means 2 and an explicit 0 is kept
     */
    public record Detection(
            Set<DetectionMethod> enabledMethods,
            Sensitivity sensitivity,
            int baselineWindow,
            Integer guardBuckets,
            double cusumSlackSigma,
            double cusumThresholdSigma,
            double ewmaLambda,
            double ewmaLimitSigma,
            double minStdDev,
            int scanPermutations,
            double scanAlpha,
            double scanMaxPopulationFraction,
            long scanSeed,
            int seasonalPeriod,
            int seasonalCycles,
            double seasonalThresholdSigma
    ) {
        public Detection {
            enabledMethods = enabledMethods == null || enabledMethods.isEmpty()
                    ? DetectionMethod.all()
                    : EnumSet.copyOf(enabledMethods);
            sensitivity = sensitivity == null ? Sensitivity.MEDIUM : sensitivity;
            baselineWindow = baselineWindow <= 0 ? 14 : baselineWindow;
            guardBuckets = guardBuckets == null ? 2 : Math.max(0, guardBuckets);
            cusumSlackSigma = cusumSlackSigma <= 0 ? 0.5 : cusumSlackSigma;
            cusumThresholdSigma = cusumThresholdSigma <= 0 ? 5.0 : cusumThresholdSigma;
            ewmaLambda = ewmaLambda <= 0 || ewmaLambda > 1 ? 0.2 : ewmaLambda;
            ewmaLimitSigma = ewmaLimitSigma <= 0 ? 3.0 : ewmaLimitSigma;
            minStdDev = minStdDev <= 0 ? 1.0 : minStdDev;
            scanPermutations = scanPermutations <= 0 ? 999 : scanPermutations;
            scanAlpha = scanAlpha <= 0 || scanAlpha >= 1 ? 0.05 : scanAlpha;
            scanMaxPopulationFraction = scanMaxPopulationFraction <= 0 || scanMaxPopulationFraction > 1
                    ? 0.5
                    : scanMaxPopulationFraction;
            scanSeed = scanSeed == 0 ? 20_250_101L : scanSeed;
            seasonalPeriod = seasonalPeriod <= 1 ? 7 : seasonalPeriod;
            seasonalCycles = seasonalCycles <= 1 ? 3 : seasonalCycles;
            seasonalThresholdSigma = seasonalThresholdSigma <= 0 ? 3.0 : seasonalThresholdSigma;
        }

        public static Detection defaults() {
            return new Detection(null, null, 0, null, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
        }

        public Detection withSensitivity(Sensitivity next) {
            return new Detection(enabledMethods, next, baselineWindow, guardBuckets, cusumSlackSigma,
                    cusumThresholdSigma, ewmaLambda, ewmaLimitSigma, minStdDev, scanPermutations, scanAlpha,
                    scanMaxPopulationFraction, scanSeed, seasonalPeriod, seasonalCycles, seasonalThresholdSigma);
        }

        public Detection withEnabledMethods(Set<DetectionMethod> methods) {
            return new Detection(methods, sensitivity, baselineWindow, guardBuckets, cusumSlackSigma,
                    cusumThresholdSigma, ewmaLambda, ewmaLimitSigma, minStdDev, scanPermutations, scanAlpha,
                    scanMaxPopulationFraction, scanSeed, seasonalPeriod, seasonalCycles, seasonalThresholdSigma);
        }

        public boolean enabled(DetectionMethod method) {
            return enabledMethods.contains(method);
        }

        public double effectiveCusumThresholdSigma() {
            return cusumThresholdSigma * sensitivity.thresholdScale();
        }

        public double effectiveEwmaLimitSigma() {
            return ewmaLimitSigma * sensitivity.thresholdScale();
        }

        public double effectiveSeasonalThresholdSigma() {
            return seasonalThresholdSigma * sensitivity.thresholdScale();
        }

        public double effectiveScanAlpha() {
            return Math.min(0.5, scanAlpha * sensitivity.scanAlpha() / Sensitivity.MEDIUM.scanAlpha());
        }

        /**
         * Buckets of history a baseline detector needs before the bucket under test.
         */
        public int baselineHistory() {
            return baselineWindow + guardBuckets;
        }

        public int seasonalWindow() {
            return seasonalPeriod * seasonalCycles;
        }
    }

    /**
     * @param cooldownBuckets      buckets during which an open alert suppresses new ones for its series
     * @param growthRateHigh       growth rate above which an alert is high severity
     * @param agreementModerate    source agreement below which a single-method alert is moderate
     */
    public record Alerting(int cooldownBuckets, double growthRateHigh, double agreementModerate) {
        public Alerting {
            cooldownBuckets = cooldownBuckets <= 0 ? 7 : cooldownBuckets;
            growthRateHigh = growthRateHigh <= 0 ? 0.5 : growthRateHigh;
            agreementModerate = agreementModerate <= 0 ? 0.7 : agreementModerate;
        }

        public static Alerting defaults() {
            return new Alerting(0, 0, 0);
        }
    }

    /**
     * @param cellWorkers   size of the per-cell worker pool; zero means one per available core
     * @param sourceWorkers size of the source fan-out pool
     */
    public record Workers(int cellWorkers, int sourceWorkers) {
        public Workers {
            cellWorkers = cellWorkers <= 0 ? Runtime.getRuntime().availableProcessors() : cellWorkers;
            sourceWorkers = sourceWorkers <= 0 ? 8 : sourceWorkers;
        }

        public static Workers defaults() {
            return new Workers(0, 0);
        }
    }
}
