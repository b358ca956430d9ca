package com.outbreaksentinel.engine.alert;

import com.outbreaksentinel.core.model.Alert;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Overall outbreak risk over a set of alerts and the monitoring recommendations that follow from it.
 *
 * @param riskScore        mean of severity, geographic spread and detector agreement, within [0, 1]
 * @param geographicSpread distinct alerted regions divided by ten, capped at one
 */
public record RiskAssessment(double riskScore, String riskLevel, double geographicSpread, List<String> recommendations) {
    static final int SPREAD_REGIONS = 10;

    /**
     * @param enabledMethods number of detection methods that ran
     * @param notices        extra lines appended to the recommendations, e.g. skipped detectors
     */
    public static RiskAssessment of(Collection<Alert> alerts, int enabledMethods, Collection<String> notices) {
        List<String> recommendations = new ArrayList<>();
        if (alerts.isEmpty()) {
            recommendations.add("Continue routine surveillance");
            recommendations.addAll(notices);
            return new RiskAssessment(0.0, level(0.0), 0.0, recommendations);
        }

        double severity = alerts.stream().mapToDouble(alert -> alert.severity().riskWeight()).average().orElse(0.0);
        Set<String> regions = new HashSet<>();
        alerts.forEach(alert -> regions.add(alert.region()));
        double spread = Math.min(1.0, regions.size() / (double) SPREAD_REGIONS);
        double agreement = alerts.stream()
                .mapToDouble(alert -> alert.methods().size() / (double) Math.max(1, enabledMethods))
                .average()
                .orElse(0.0);
        double score = (severity + spread + Math.min(1.0, agreement)) / 3.0;

        if (score >= 0.6) {
            recommendations.add("Activate enhanced surveillance protocols");
        }
        if (spread > 0.5) {
            recommendations.add("Coordinate multi-jurisdictional response");
        }
        for (Alert alert : alerts) {
            switch (alert.severity()) {
                case HIGH -> recommendations.add("Deploy field investigation for " + alert.disease() + " in " + alert.region());
                case MODERATE -> recommendations.add("Increase testing and reporting frequency for "
                        + alert.disease() + " in " + alert.region());
                default -> recommendations.add("Monitor " + alert.disease() + " trends in " + alert.region());
            }
        }
        recommendations.addAll(notices);
        return new RiskAssessment(score, level(score), spread, recommendations);
    }

    static String level(double score) {
        if (score >= 0.8) {
            return "critical";
        }
        if (score >= 0.6) {
            return "high";
        }
        if (score >= 0.4) {
            return "medium";
        }
        if (score >= 0.2) {
            return "low";
        }
        return "minimal";
    }
}
