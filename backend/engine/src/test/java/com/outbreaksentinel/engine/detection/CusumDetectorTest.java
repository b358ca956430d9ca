package com.outbreaksentinel.engine.detection;

import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.TimeBucket;
import com.outbreaksentinel.engine.config.EngineConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.outbreaksentinel.engine.support.Estimates.series;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CusumDetectorTest {
    private static final EngineConfig.Detection SETTINGS = EngineConfig.Detection.defaults();
    private static final TimeBucket START = TimeBucket.parse("2020-01-01");

    private final CusumDetector detector = new CusumDetector();

    @Test
    void inControlSeriesStaysNearNominalFalseAlarmRate() {
        Random random = new Random(20_250_101L);
        double[] values = new double[1016];
        for (int i = 0; i < values.length; i++) {
            values[i] = 100.0 + 10.0 * random.nextGaussian();
        }
        List<FusedEstimate> full = series("US-CA", "influenza", START, values);

        int fired = 0;
        for (int end = SETTINGS.baselineHistory(); end < full.size(); end++) {
            if (detector.detect(input(full.subList(0, end + 1)), SETTINGS).fired()) {
                fired++;
            }
        }

        assertTrue(fired <= 20, "false alarms over 1000 in-control periods: " + fired);
    }

    @Test
    void sustainedFiveSigmaStepFiresWithinFivePeriods() {
        double[] flat = alternating(30);
        double sigma = Math.sqrt(14.0 / 13.0);
        double[] stepped = new double[40];
        for (int i = 0; i < stepped.length; i++) {
            stepped[i] = i < 30 ? flat[i] : flat[i % 2] + 5.0 * sigma;
        }
        List<FusedEstimate> full = series("US-CA", "influenza", START, stepped);

        int firstFire = -1;
        for (int end = 30; end < full.size() && firstFire < 0; end++) {
            DetectorResult result = detector.detect(input(full.subList(0, end + 1)), SETTINGS);
            if (result.fired()) {
                firstFire = end;
                assertEquals(DetectionMethod.CUSUM, result.signal().method());
                assertTrue(result.signal().statistic() > result.signal().threshold());
                assertFalse(result.signal().estimatedStart().isAfter(TimeBucket.parse("2020-01-31")));
            }
        }

        assertTrue(firstFire >= 30 && firstFire - 30 < 5, "fired at index " + firstFire);
        for (int end = SETTINGS.baselineHistory(); end < 30; end++) {
            assertFalse(detector.detect(input(full.subList(0, end + 1)), SETTINGS).fired());
        }
    }

    @Test
    void shortSeriesIsSkipped() {
        DetectorResult result = detector.detect(input(series("US-CA", "influenza", START, alternating(16))), SETTINGS);

        assertTrue(result.skipped());
        assertEquals(DetectorResult.INSUFFICIENT_HISTORY, result.skipReason());
    }

    @Test
    void rerunOnUnchangedSeriesGivesSameSignal() {
        double[] values = alternating(20);
        values[19] = 160.0;
        DetectionInput input = input(series("US-CA", "influenza", START, values));

        DetectorResult first = detector.detect(input, SETTINGS);
        DetectorResult second = detector.detect(input, SETTINGS);

        assertTrue(first.fired());
        assertEquals(first, second);
    }

    static double[] alternating(int size) {
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = i % 2 == 0 ? 99.0 : 101.0;
        }
        return values;
    }

    static DetectionInput input(List<FusedEstimate> series) {
        return new DetectionInput(series.get(series.size() - 1).cellKey(), series, List.of());
    }
}
