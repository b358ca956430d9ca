package com.outbreaksentinel.engine.pipeline;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.engine.alert.AggregationOutcome;
import com.outbreaksentinel.engine.detection.DetectorResult;
import com.outbreaksentinel.engine.detection.DetectorSignal;
import com.outbreaksentinel.engine.detection.OutbreakDetector;

import java.util.List;

/**
 * Detector results for one cell and what the aggregator made of them.
 */
public record DetectionReport(CellKey cell, List<DetectorResult> results, AggregationOutcome outcome) {
    public DetectionReport {
        results = results == null ? List.of() : List.copyOf(results);
        outcome = outcome == null ? AggregationOutcome.none() : outcome;
    }

    public List<DetectorSignal> signals() {
        return OutbreakDetector.signals(results);
    }

    /**
     * Fired signals that do not indicate an outbreak, i.e. significant decreases.
     */
    public List<DetectorSignal> anomalies() {
        return signals().stream().filter(signal -> !signal.outbreak()).toList();
    }

    public List<DetectorResult> skipped() {
        return results.stream().filter(DetectorResult::skipped).toList();
    }
}
