package com.outbreaksentinel.collectors.api;

import com.outbreaksentinel.core.model.BucketRange;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.SeriesKey;
import com.outbreaksentinel.core.model.TimeBucket;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * The cells a poll asks every source for: each region crossed with each disease over a bucket range.
 */
public record SourceQuery(List<String> regions, List<String> diseases, BucketRange range) {
    public SourceQuery {
        Objects.requireNonNull(range, "range is required");
        regions = regions == null ? List.of() : regions.stream().map(String::trim).distinct().toList();
        diseases = diseases == null ? List.of() : diseases.stream()
                .map(disease -> disease.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        if (regions.isEmpty() || diseases.isEmpty()) {
            throw new IllegalArgumentException("a source query needs at least one region and one disease");
        }
    }

    public List<SeriesKey> series() {
        List<SeriesKey> keys = new ArrayList<>();
        for (String region : regions) {
            for (String disease : diseases) {
                keys.add(new SeriesKey(region, disease));
            }
        }
        return keys;
    }

    public List<CellKey> cells() {
        List<CellKey> cells = new ArrayList<>();
        for (SeriesKey series : series()) {
            for (TimeBucket bucket : range.buckets()) {
                cells.add(series.at(bucket));
            }
        }
        return cells;
    }

    public boolean matches(CellKey cell) {
        return regions.contains(cell.region())
                && diseases.contains(cell.disease())
                && cell.timeBucket().granularity() == range.from().granularity()
                && range.contains(cell.timeBucket());
    }
}
