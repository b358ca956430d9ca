package com.outbreaksentinel.engine.quality;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.SourceEstimate;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Leave-one-out z-score screen over the sources of each cell. A cell needs at least three reporting
 * sources. The spread of the other sources is floored at one percent of their mean so that exact
 * agreement among them does not turn rounding noise into an outlier.
 */
public class CrossSourceOutlierScreen {
    public static final int MIN_SOURCES = 3;
    static final double ANOMALY_Z = 2.5;
    static final double HIGH_Z = 3.0;

    public List<SourceAnomaly> screen(Collection<SourceEstimate> estimates) {
        Map<CellKey, Map<String, SourceEstimate>> byCell = new TreeMap<>(Comparator.comparing(CellKey::toString));
        for (SourceEstimate estimate : estimates) {
            if (!estimate.usable()) {
                continue;
            }
            byCell.computeIfAbsent(estimate.cellKey(), ignored -> new LinkedHashMap<>())
                    .merge(estimate.sourceId(), estimate, (current, candidate) ->
                            candidate.observedAt().isAfter(current.observedAt()) ? candidate : current);
        }

        List<SourceAnomaly> anomalies = new ArrayList<>();
        byCell.forEach((cell, bySource) -> {
            if (bySource.size() < MIN_SOURCES) {
                return;
            }
            List<SourceEstimate> reports = new ArrayList<>(bySource.values());
            for (SourceEstimate candidate : reports) {
                DescriptiveStatistics others = new DescriptiveStatistics();
                reports.stream().filter(other -> other != candidate).forEach(other -> others.addValue(other.value()));
                double mean = others.getMean();
                double spread = Math.max(others.getStandardDeviation(), Math.max(1e-9, 0.01 * Math.abs(mean)));
                double z = Math.abs(candidate.value() - mean) / spread;
                if (z > ANOMALY_Z) {
                    anomalies.add(new SourceAnomaly(candidate.sourceId(), cell, candidate.value(), mean, z,
                            z > HIGH_Z ? "high" : "medium"));
                }
            }
        });
        return anomalies;
    }
}
