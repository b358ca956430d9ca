package com.outbreaksentinel.collectors.api;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record RawSourceBatch(String sourceId, List<RawRecord> records, Instant fetchedAt) {
    public RawSourceBatch {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        records = records == null ? List.of() : List.copyOf(records);
    }
}
