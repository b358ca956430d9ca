package com.outbreaksentinel.engine.fusion;

import com.outbreaksentinel.core.error.InsufficientDataException;
import com.outbreaksentinel.core.error.InvalidMethodException;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.core.model.SourceEstimate;
import com.outbreaksentinel.engine.config.EngineConfig;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static com.outbreaksentinel.engine.support.Estimates.cell;
import static com.outbreaksentinel.engine.support.Estimates.fused;
import static com.outbreaksentinel.engine.support.Estimates.source;
import static com.outbreaksentinel.engine.support.Estimates.stale;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FusionEngineTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-21T00:00:00Z"), ZoneOffset.UTC);
    private static final CellKey CELL = cell("US-CA", "influenza", "2025-W03");

    private final FusionEngine engine = new FusionEngine(EngineConfig.defaults(), CLOCK);

    @Test
    void singleEstimateIsReturnedUnchangedByEveryMethod() {
        for (FusionMethod method : FusionMethod.values()) {
            FusedEstimate result = engine.fuse(CELL, List.of(source("WHO", CELL, 42.0, 0.8)), method, null);

            assertEquals(42.0, result.mean(), 1e-9, method.wireName());
            assertTrue(Double.isFinite(result.variance()), method.wireName());
            assertEquals(1.0, result.agreementScore(), 1e-12, method.wireName());
            assertEquals(method, result.method());
            assertEquals(Set.of("WHO"), result.sourcesUsed());
        }
    }

    @Test
    void threeSourceBayesianExample() {
        FusedEstimate result = engine.fuse(CELL, List.of(
                source("WHO", CELL, 120.0, 0.95),
                source("CDC", CELL, 135.0, 0.98),
                source("ECDC", CELL, 150.0, 0.92)
        ), FusionMethod.BAYESIAN, null);

        double posteriorVariance = 100.0 / (0.95 + 0.98 + 0.92);
        assertEquals(134.84, result.mean(), 0.01);
        assertEquals(0.4039, result.agreementScore(), 1e-4);
        assertEquals(posteriorVariance / result.agreementScore(), result.variance(), 1e-9);
        assertEquals(Set.of("CDC", "ECDC", "WHO"), result.sourcesUsed());
        assertEquals(CLOCK.instant(), result.computedAt());
    }

    @Test
    void widerDisagreementLowersAgreementAndRaisesVariance() {
        for (FusionMethod method : List.of(FusionMethod.BAYESIAN, FusionMethod.WEIGHTED_AVERAGE)) {
            double previousAgreement = 1.0;
            double previousVariance = -1.0;
            for (double gap : new double[]{0.0, 5.0, 20.0, 60.0}) {
                FusedEstimate result = engine.fuse(CELL, List.of(
                        source("WHO", CELL, 100.0, 0.9),
                        source("CDC", CELL, 100.0 + gap, 0.9)
                ), method, null);
                if (gap > 0.0) {
                    assertTrue(result.agreementScore() < previousAgreement, method + " agreement at gap " + gap);
                    assertTrue(result.variance() > previousVariance, method + " variance at gap " + gap);
                }
                previousAgreement = result.agreementScore();
                previousVariance = result.variance();
            }
        }
    }

    @Test
    void agreeingSourcesReportThePlainPosteriorVariance() {
        EngineConfig unitBaseline = new EngineConfig(
                new EngineConfig.Fusion(null, 1.0, 0, 0, 0, 0, 0, null, null), null, null, null, null);
        FusionEngine unit = new FusionEngine(unitBaseline, CLOCK);

        FusedEstimate result = unit.fuse(CELL, List.of(
                source("WHO", CELL, 135.0, 0.95),
                source("CDC", CELL, 135.0, 0.98),
                source("ECDC", CELL, 135.0, 0.92)
        ), FusionMethod.BAYESIAN, null);

        assertEquals(1.0, result.agreementScore(), 1e-12);
        assertEquals(1.0 / 2.85, result.variance(), 1e-12);
    }

    @Test
    void agreementTracksRawSpreadRegardlessOfMagnitude() {
        for (FusionMethod method : List.of(FusionMethod.BAYESIAN, FusionMethod.WEIGHTED_AVERAGE)) {
            FusedEstimate small = engine.fuse(CELL, List.of(
                    source("WHO", CELL, 10.0, 0.9),
                    source("CDC", CELL, 15.0, 0.9)
            ), method, null);
            FusedEstimate large = engine.fuse(CELL, List.of(
                    source("WHO", CELL, 1000.0, 0.9),
                    source("CDC", CELL, 1100.0, 0.9)
            ), method, null);

            assertEquals(1.0 / (1.0 + 6.25 / 100.0), small.agreementScore(), 1e-12, method.wireName());
            assertEquals(1.0 / (1.0 + 2500.0 / 100.0), large.agreementScore(), 1e-12, method.wireName());
            assertTrue(large.agreementScore() < small.agreementScore(), method.wireName());
        }
    }

    @Test
    void missingEstimatesOnlyPopulateSourcesFailed() {
        FusedEstimate result = engine.fuse(CELL, List.of(
                source("WHO", CELL, 120.0, 0.95),
                SourceEstimate.missing("ECDC", CELL, 0.92, Instant.parse("2025-01-20T00:00:00Z"))
        ), FusionMethod.BAYESIAN, null);

        assertEquals(120.0, result.mean(), 1e-9);
        assertEquals(Set.of("WHO"), result.sourcesUsed());
        assertEquals(Set.of("ECDC"), result.sourcesFailed());
    }

    @Test
    void staleEstimatesCountWithDiscountedReliability() {
        FusedEstimate fresh = engine.fuse(CELL, List.of(
                source("WHO", CELL, 100.0, 0.8),
                source("CDC", CELL, 200.0, 0.8)
        ), FusionMethod.WEIGHTED_AVERAGE, null);
        FusedEstimate withStale = engine.fuse(CELL, List.of(
                source("WHO", CELL, 100.0, 0.8),
                stale("CDC", CELL, 200.0, 0.8)
        ), FusionMethod.WEIGHTED_AVERAGE, null);

        assertEquals(150.0, fresh.mean(), 1e-9);
        assertEquals((0.8 * 100.0 + 0.4 * 200.0) / 1.2, withStale.mean(), 1e-9);
        assertTrue(withStale.sourcesUsed().contains("CDC"));
    }

    @Test
    void latestEstimatePerSourceWins() {
        FusedEstimate result = engine.fuse(CELL, List.of(
                source("WHO", CELL, 90.0, 0.9, Instant.parse("2025-01-19T00:00:00Z")),
                source("WHO", CELL, 110.0, 0.9, Instant.parse("2025-01-20T00:00:00Z"))
        ), FusionMethod.BAYESIAN, null);

        assertEquals(110.0, result.mean(), 1e-9);
        assertEquals(1.0, result.agreementScore(), 1e-12);
    }

    @Test
    void zeroReliabilitySourceIsIgnoredWithWarning() {
        FusedEstimate result = engine.fuse(CELL, List.of(
                source("WHO", CELL, 100.0, 0.9),
                source("BLOG", CELL, 900.0, 0.0)
        ), FusionMethod.BAYESIAN, null);

        assertEquals(100.0, result.mean(), 1e-9);
        assertTrue(result.warnings().contains("zero_reliability_ignored:BLOG"));
    }

    @Test
    void allMissingIsInsufficientDataEvenWithPrior() {
        FusedEstimate prior = fused(cell("US-CA", "influenza", "2025-W02"), 100.0);
        InsufficientDataException error = assertThrows(InsufficientDataException.class, () -> engine.fuse(CELL, List.of(
                SourceEstimate.missing("WHO", CELL, 0.9, Instant.parse("2025-01-20T00:00:00Z"))
        ), FusionMethod.BAYESIAN, prior));

        assertEquals("insufficient_data", error.code());
        assertEquals(CELL, error.cellKey());
    }

    @Test
    void emptyEstimatesCarryPriorForward() {
        FusedEstimate prior = fused(cell("US-CA", "influenza", "2025-W02"), 100.0, 4.0);

        FusedEstimate result = engine.fuse(CELL, List.of(), FusionMethod.BAYESIAN, prior);

        assertEquals(CELL, result.cellKey());
        assertEquals(100.0, result.mean(), 1e-9);
        assertEquals(0.0, result.agreementScore(), 1e-12);
        assertTrue(result.sourcesUsed().isEmpty());
        assertTrue(result.warnings().contains(FusedEstimate.CARRIED_FORWARD));
        assertThrows(InsufficientDataException.class, () -> engine.fuse(CELL, List.of(), FusionMethod.BAYESIAN, null));
    }

    @Test
    void unknownMethodNameIsRejected() {
        List<SourceEstimate> estimates = List.of(source("WHO", CELL, 1.0, 1.0));
        InvalidMethodException error = assertThrows(InvalidMethodException.class,
                () -> engine.fuse(CELL, estimates, "majority_vote", null));

        assertEquals("invalid_method", error.code());
        assertEquals(FusionMethod.CONSENSUS, engine.fuse(CELL, estimates, "consensus_fusion", null).method());
        assertEquals(FusionMethod.BAYESIAN, engine.fuse(CELL, estimates, (String) null, null).method());
    }

    @Test
    void estimateForAnotherCellIsRejected() {
        CellKey other = cell("US-TX", "influenza", "2025-W03");

        assertThrows(IllegalArgumentException.class,
                () -> engine.fuse(CELL, List.of(source("WHO", other, 1.0, 1.0)), FusionMethod.BAYESIAN, null));
    }
}
