package com.outbreaksentinel.engine.fusion;

import com.outbreaksentinel.core.error.ConflictingEvidenceException;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Belief fusion over ordinal risk bands. Each source puts mass {@code reliability} on the band its
 * value falls in and the rest on the whole frame; masses are combined pairwise with Dempster's rule.
 * The numeric estimate weights each source by {@code reliability × belief(band)} of the combined mass.
 *
 * <p>Agreement is {@code 1 − K} where {@code K = 1 − Π(1 − K_j)} accumulates the conflict of every
 * pairwise combination. Conflict at or above the configured ceiling is not fatal: the strategy falls
 * back to reliability weights and reports {@link FusedEstimate#CONFLICTING_EVIDENCE}.
 */
public class DempsterShaferFusion implements FusionStrategy {
    private static final Logger LOGGER = Logger.getLogger(DempsterShaferFusion.class.getName());
    private static final int FRAME = 0b111;

    @Override
    public FusionMethod method() {
        return FusionMethod.DEMPSTER_SHAFER;
    }

    @Override
    public FusionResult fuse(FusionInput input, EngineConfig.Fusion settings) {
        RiskBandSchema schema = settings.bandsFor(input.cell().disease());
        double[] values = input.values();
        double[] reliabilities = input.weights();
        int[] bands = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            bands[i] = singleton(schema.bandOf(values[i]));
        }

        try {
            Combination combined = combine(bands, reliabilities, settings.conflictCeiling());
            double[] weights = new double[values.length];
            double total = 0.0;
            for (int i = 0; i < values.length; i++) {
                weights[i] = reliabilities[i] * combined.masses().getOrDefault(bands[i], 0.0);
                total += weights[i];
            }
            if (total <= 0.0) {
                weights = reliabilities;
            }
            double mean = FusionMath.weightedMean(values, weights);
            double variance = FusionMath.weightedVariance(values, weights, mean);
            return new FusionResult(mean, variance, 1.0 - combined.conflict());
        } catch (ConflictingEvidenceException e) {
            LOGGER.warning("Contradictory band evidence for " + input.cell() + ": " + e.getMessage());
            double mean = FusionMath.weightedMean(values, reliabilities);
            double variance = FusionMath.weightedVariance(values, reliabilities, mean);
            return new FusionResult(
                    mean,
                    variance,
                    1.0 - Math.min(1.0, e.conflictMass()),
                    List.of(FusedEstimate.CONFLICTING_EVIDENCE)
            );
        }
    }

    /**
     * Sequential Dempster combination of simple support functions.
     *
     * @throws ConflictingEvidenceException when the accumulated conflict reaches {@code ceiling}
     */
    static Combination combine(int[] bands, double[] reliabilities, double ceiling) {
        Map<Integer, Double> current = simpleSupport(bands[0], reliabilities[0]);
        double consistent = 1.0;
        for (int i = 1; i < bands.length; i++) {
            Map<Integer, Double> next = simpleSupport(bands[i], reliabilities[i]);
            Map<Integer, Double> merged = new HashMap<>();
            double conflict = 0.0;
            for (Map.Entry<Integer, Double> left : current.entrySet()) {
                for (Map.Entry<Integer, Double> right : next.entrySet()) {
                    int intersection = left.getKey() & right.getKey();
                    double product = left.getValue() * right.getValue();
                    if (intersection == 0) {
                        conflict += product;
                    } else {
                        merged.merge(intersection, product, Double::sum);
                    }
                }
            }
            consistent *= (1.0 - conflict);
            double accumulated = 1.0 - consistent;
            if (conflict >= 1.0 || accumulated >= ceiling) {
                throw new ConflictingEvidenceException(accumulated);
            }
            double normalizer = 1.0 - conflict;
            merged.replaceAll((set, mass) -> mass / normalizer);
            current = merged;
        }
        return new Combination(current, 1.0 - consistent);
    }

    private static Map<Integer, Double> simpleSupport(int band, double reliability) {
        Map<Integer, Double> masses = new HashMap<>();
        masses.put(band, reliability);
        if (reliability < 1.0) {
            masses.merge(FRAME, 1.0 - reliability, Double::sum);
        }
        return masses;
    }

    private static int singleton(RiskBandSchema.Band band) {
        return 1 << band.ordinal();
    }

    record Combination(Map<Integer, Double> masses, double conflict) {
    }
}
