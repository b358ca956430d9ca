package com.outbreaksentinel.engine.detection;

import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;

/**
 * One outbreak detection algorithm. Implementations recompute every statistic from the input, so
 * repeated calls on an unchanged series return the same result.
 */
public interface Detector {
    DetectionMethod method();

    DetectorResult detect(DetectionInput input, EngineConfig.Detection settings);
}
