package com.outbreaksentinel.engine.detection;

import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Runs every enabled detection algorithm against one cell. Each algorithm contributes one result:
 * fired with a signal, quiet, or skipped with a reason.
 */
public class OutbreakDetector {
    private static final Logger LOGGER = Logger.getLogger(OutbreakDetector.class.getName());

    private final EngineConfig.Detection defaults;
    private final Map<DetectionMethod, Detector> detectors = new EnumMap<>(DetectionMethod.class);

    public OutbreakDetector(EngineConfig config) {
        this(config, List.of(
                new CusumDetector(),
                new EwmaDetector(),
                new SpatialScanDetector(),
                new SeasonalBaselineDetector()
        ));
    }

    public OutbreakDetector(EngineConfig config, List<Detector> detectors) {
        this.defaults = config.detection();
        detectors.forEach(detector -> this.detectors.put(detector.method(), detector));
    }

    public EngineConfig.Detection settings() {
        return defaults;
    }

    public List<DetectorResult> detect(DetectionInput input) {
        return detect(input, defaults);
    }

    public List<DetectorResult> detect(DetectionInput input, EngineConfig.Detection settings) {
        List<DetectorResult> results = new ArrayList<>();
        for (DetectionMethod method : settings.enabledMethods()) {
            Detector detector = detectors.get(method);
            if (detector == null) {
                continue;
            }
            DetectorResult result = detector.detect(input, settings);
            if (result.skipped()) {
                LOGGER.fine(() -> method.wireName() + " skipped for " + input.cell() + ": " + result.skipReason());
            }
            results.add(result);
        }
        return results;
    }

    public static List<DetectorSignal> signals(List<DetectorResult> results) {
        return results.stream().filter(DetectorResult::fired).map(DetectorResult::signal).toList();
    }
}
