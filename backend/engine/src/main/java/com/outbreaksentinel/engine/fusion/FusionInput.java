package com.outbreaksentinel.engine.fusion;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusedEstimate;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * @param prior latest fused estimate for an earlier bucket of the same series, or {@code null}
 */
public record FusionInput(CellKey cell, List<Observation> observations, FusedEstimate prior) {
    public FusionInput {
        Objects.requireNonNull(cell, "cell is required");
        if (observations == null || observations.isEmpty()) {
            throw new IllegalArgumentException("fusion needs at least one observation for " + cell);
        }
        observations = observations.stream()
                .sorted(Comparator.comparing(Observation::observedAt).thenComparing(Observation::sourceId))
                .toList();
        if (prior != null && !prior.timeBucket().isBefore(cell.timeBucket())) {
            prior = null;
        }
    }

    public double[] values() {
        return observations.stream().mapToDouble(Observation::value).toArray();
    }

    public double[] weights() {
        return observations.stream().mapToDouble(Observation::weight).toArray();
    }

    public int size() {
        return observations.size();
    }
}
