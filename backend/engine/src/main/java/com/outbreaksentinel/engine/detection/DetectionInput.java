package com.outbreaksentinel.engine.detection;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.TimeBucket;

import java.util.List;
import java.util.Objects;

/**
 * What a detection pass sees for one cell: the series in bucket order ending at the cell's bucket,
 * and the same-disease counts of every located region for that bucket.
 */
public record DetectionInput(CellKey cell, List<FusedEstimate> series, List<SpatialCell> spatial) {
    public DetectionInput {
        Objects.requireNonNull(cell, "cell is required");
        series = series == null ? List.of() : List.copyOf(series);
        spatial = spatial == null ? List.of() : List.copyOf(spatial);
        if (!series.isEmpty() && !series.get(series.size() - 1).timeBucket().equals(cell.timeBucket())) {
            throw new IllegalArgumentException("series for " + cell + " must end at its bucket");
        }
    }

    public double[] values() {
        return series.stream().mapToDouble(FusedEstimate::mean).toArray();
    }

    public TimeBucket bucketAt(int index) {
        return series.get(index).timeBucket();
    }

    public FusedEstimate current() {
        return series.get(series.size() - 1);
    }
}
