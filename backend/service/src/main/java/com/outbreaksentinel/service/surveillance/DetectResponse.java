package com.outbreaksentinel.service.surveillance;

import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.core.model.Sensitivity;
import com.outbreaksentinel.engine.detection.DetectorSignal;

import java.util.List;

/**
 * @param outbreaksDetected alerts emitted by this request
 * @param activeAlerts      open alerts of the evaluated series after the request, new or earlier
 * @param anomalies         significant decreases, reported but never alerted on
 */
public record DetectResponse(
        int alertsGenerated,
        List<Alert> outbreaksDetected,
        List<Alert> activeAlerts,
        int suppressedAlerts,
        List<DetectorSignal> anomalies,
        double riskScore,
        String riskLevel,
        double geographicSpread,
        List<String> monitoringRecommendations,
        int seriesEvaluated,
        List<DetectionMethod> methodsUsed,
        Sensitivity sensitivity
) {
}
