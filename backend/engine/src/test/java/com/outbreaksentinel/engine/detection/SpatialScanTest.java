package com.outbreaksentinel.engine.detection;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.core.model.RegionProfile;
import com.outbreaksentinel.engine.config.EngineConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.outbreaksentinel.engine.support.Estimates.cell;
import static com.outbreaksentinel.engine.support.Estimates.fused;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpatialScanTest {
    private static final long POPULATION = 100_000L;

    @Test
    void recoversInjectedCluster() {
        SpatialScan.Cluster cluster = SpatialScan.scan(clusteredCells(), 999, 0.5, 42L);

        assertEquals(Set.of("C1", "C2", "C3"), Set.copyOf(cluster.regions()));
        assertTrue(cluster.pValue() < 0.05, "p = " + cluster.pValue());
        assertTrue(cluster.radiusKm() < 20.0);
        assertEquals(120.0, cluster.observed(), 1e-9);
        assertEquals(3 * POPULATION, cluster.population());
        assertTrue(cluster.significant(0.05));
    }

    @Test
    void uniformRatesAreNotSignificant() {
        List<SpatialCell> cells = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            cells.add(new SpatialCell(new RegionProfile("R" + i, i % 4, i / 4, POPULATION), 10.0));
        }

        SpatialScan.Cluster cluster = SpatialScan.scan(cells, 199, 0.5, 42L);

        assertFalse(cluster.significant(0.05));
    }

    @Test
    void sameSeedGivesSamePValue() {
        SpatialScan.Cluster first = SpatialScan.scan(clusteredCells(), 99, 0.5, 7L);
        SpatialScan.Cluster second = SpatialScan.scan(clusteredCells(), 99, 0.5, 7L);

        assertEquals(first, second);
    }

    @Test
    void detectorFiresOnlyForRegionsInsideTheCluster() {
        SpatialScanDetector detector = new SpatialScanDetector();
        EngineConfig.Detection settings = EngineConfig.Detection.defaults();

        DetectorResult inside = detector.detect(input(cell("C2", "cholera", "2025-W10")), settings);
        DetectorResult outside = detector.detect(input(cell("B4", "cholera", "2025-W10")), settings);

        assertTrue(inside.fired());
        assertEquals(DetectionMethod.SPATIAL_SCAN, inside.signal().method());
        assertEquals(3 * POPULATION, inside.signal().affectedPopulation());
        assertTrue(inside.signal().confidence() > 0.95);
        assertEquals(DetectorResult.Status.QUIET, outside.status());
    }

    @Test
    void tooFewLocatedRegionsIsSkipped() {
        SpatialScanDetector detector = new SpatialScanDetector();
        CellKey cell = cell("C1", "cholera", "2025-W10");
        List<SpatialCell> two = clusteredCells().subList(0, 2);

        DetectorResult result = detector.detect(new DetectionInput(cell, List.of(fused(cell, 40.0)), two),
                EngineConfig.Detection.defaults());
        DetectorResult unlocated = detector.detect(input(cell("ZZ", "cholera", "2025-W10")),
                EngineConfig.Detection.defaults());

        assertEquals(DetectorResult.INSUFFICIENT_LOCATIONS, result.skipReason());
        assertEquals(DetectorResult.INSUFFICIENT_LOCATIONS, unlocated.skipReason());
    }

    static List<SpatialCell> clusteredCells() {
        List<SpatialCell> cells = new ArrayList<>();
        cells.add(new SpatialCell(new RegionProfile("C1", 0.0, 0.0, POPULATION), 40.0));
        cells.add(new SpatialCell(new RegionProfile("C2", 0.0, 0.1, POPULATION), 40.0));
        cells.add(new SpatialCell(new RegionProfile("C3", 0.1, 0.0, POPULATION), 40.0));
        for (int k = 0; k < 17; k++) {
            int row = k / 4;
            int column = k % 4;
            cells.add(new SpatialCell(new RegionProfile("B" + k, 2.0 + row, 2.0 + column, POPULATION), 10.0));
        }
        return cells;
    }

    private static DetectionInput input(CellKey cell) {
        return new DetectionInput(cell, List.of(fused(cell, 40.0)), clusteredCells());
    }
}
