package com.outbreaksentinel.engine.quality;

import com.outbreaksentinel.core.model.CellKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.outbreaksentinel.engine.support.Estimates.cell;
import static com.outbreaksentinel.engine.support.Estimates.fused;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfidenceScoreTest {
    private static final CellKey CELL = cell("US-CA", "influenza", "2025-W03");

    @Test
    void blendsQualityAgreementCoverageAndPrecision() {
        List<SourceQuality> qualities = List.of(
                new SourceQuality("WHO", 1, 1, 1, 1, 0.8, "B"),
                new SourceQuality("CDC", 1, 1, 1, 1, 0.6, "D")
        );

        double score = ConfidenceScore.of(qualities, List.of(fused(CELL, 100.0, 100.0)), 2);

        assertEquals(0.3 * 0.7 + 0.25 * 1.0 + 0.15 * 0.4 + 0.3 * 0.9, score, 1e-12);
    }

    @Test
    void nothingFusedScoresOnlyCoverageAndQuality() {
        assertEquals(0.15 * 0.2, ConfidenceScore.of(List.of(), List.of(), 1), 1e-12);
    }
}
