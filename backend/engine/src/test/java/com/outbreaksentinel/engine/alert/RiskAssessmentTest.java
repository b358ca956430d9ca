package com.outbreaksentinel.engine.alert;

import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.model.BucketRange;
import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.core.model.Severity;
import com.outbreaksentinel.core.model.TimeBucket;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RiskAssessmentTest {
    @Test
    void noAlertsIsMinimalRisk() {
        RiskAssessment risk = RiskAssessment.of(List.of(), 4, List.of("Source ECDC failed"));

        assertEquals("minimal", risk.riskLevel());
        assertEquals(List.of("Continue routine surveillance", "Source ECDC failed"), risk.recommendations());
    }

    @Test
    void widespreadHighSeverityAlertsAreCritical() {
        List<Alert> alerts = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            alerts.add(alert("R" + i, Severity.HIGH, Set.of(DetectionMethod.CUSUM, DetectionMethod.EWMA,
                    DetectionMethod.SPATIAL_SCAN, DetectionMethod.SEASONAL_BASELINE)));
        }

        RiskAssessment risk = RiskAssessment.of(alerts, 4, List.of());

        assertEquals((0.75 + 0.8 + 1.0) / 3.0, risk.riskScore(), 1e-12);
        assertEquals("critical", risk.riskLevel());
        assertTrue(risk.recommendations().contains("Activate enhanced surveillance protocols"));
        assertTrue(risk.recommendations().contains("Coordinate multi-jurisdictional response"));
        assertTrue(risk.recommendations().contains("Deploy field investigation for influenza in R3"));
    }

    @Test
    void singleLowAlertIsLowRisk() {
        RiskAssessment risk = RiskAssessment.of(List.of(
                alert("US-CA", Severity.LOW, Set.of(DetectionMethod.EWMA, DetectionMethod.CUSUM))), 4, List.of());

        assertEquals((0.25 + 0.1 + 0.5) / 3.0, risk.riskScore(), 1e-12);
        assertEquals("low", risk.riskLevel());
        assertEquals(List.of("Monitor influenza trends in US-CA"), risk.recommendations());
    }

    private static Alert alert(String region, Severity severity, Set<DetectionMethod> methods) {
        TimeBucket bucket = TimeBucket.parse("2025-W04");
        return new Alert("a-" + region, region, "influenza", Instant.parse("2025-02-01T00:00:00Z"), bucket,
                BucketRange.single(bucket), methods, severity, 0.9, bucket, 0.1, 1000L);
    }
}
