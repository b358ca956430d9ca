package com.outbreaksentinel.engine.support;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.core.model.SourceEstimate;
import com.outbreaksentinel.core.model.SourceStatus;
import com.outbreaksentinel.core.model.TimeBucket;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public final class Estimates {
    public static final Instant OBSERVED = Instant.parse("2025-01-20T00:00:00Z");

    private Estimates() {
    }

    public static CellKey cell(String region, String disease, String bucket) {
        return new CellKey(region, disease, TimeBucket.parse(bucket));
    }

    public static SourceEstimate source(String sourceId, CellKey cell, double value, double reliability) {
        return source(sourceId, cell, value, reliability, OBSERVED);
    }

    public static SourceEstimate source(String sourceId, CellKey cell, double value, double reliability, Instant observedAt) {
        return new SourceEstimate(sourceId, cell.region(), cell.disease(), cell.timeBucket(), value, reliability,
                observedAt, SourceStatus.OK);
    }

    public static SourceEstimate stale(String sourceId, CellKey cell, double value, double reliability) {
        return new SourceEstimate(sourceId, cell.region(), cell.disease(), cell.timeBucket(), value, reliability,
                OBSERVED, SourceStatus.STALE);
    }

    public static FusedEstimate fused(CellKey cell, double mean) {
        return fused(cell, mean, 1.0);
    }

    public static FusedEstimate fused(CellKey cell, double mean, double variance) {
        return new FusedEstimate(cell.region(), cell.disease(), cell.timeBucket(), mean, variance,
                FusionMethod.BAYESIAN, Set.of("WHO"), Set.of(), 1.0, OBSERVED, List.of());
    }

    /**
     * Consecutive fused estimates for one series, the first at {@code start}.
     */
    public static List<FusedEstimate> series(String region, String disease, TimeBucket start, double... means) {
        List<FusedEstimate> series = new ArrayList<>();
        TimeBucket bucket = start;
        for (double mean : means) {
            series.add(fused(new CellKey(region, disease, bucket), mean));
            bucket = bucket.next();
        }
        return series;
    }
}
