package com.outbreaksentinel.engine.store;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.SeriesKey;
import com.outbreaksentinel.core.model.SourceEstimate;
import com.outbreaksentinel.core.model.TimeBucket;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.outbreaksentinel.engine.support.Estimates.cell;
import static com.outbreaksentinel.engine.support.Estimates.source;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CellLedgerTest {
    private static final CellKey CELL = cell("US-CA", "influenza", "2025-W03");

    @Test
    void laterCorrectionReplacesOnlyItsOwnSource() {
        CellLedger ledger = new CellLedger();
        ledger.merge(CELL, List.of(
                source("WHO", CELL, 120.0, 0.95, Instant.parse("2025-01-20T00:00:00Z")),
                source("CDC", CELL, 135.0, 0.98, Instant.parse("2025-01-20T00:00:00Z"))
        ));

        List<SourceEstimate> merged = ledger.merge(CELL, List.of(
                source("WHO", CELL, 125.0, 0.95, Instant.parse("2025-01-22T00:00:00Z"))));

        assertEquals(2, merged.size());
        assertTrue(merged.stream().anyMatch(e -> e.sourceId().equals("WHO") && e.value() == 125.0));
        assertTrue(merged.stream().anyMatch(e -> e.sourceId().equals("CDC") && e.value() == 135.0));
    }

    @Test
    void failedPollDoesNotEraseEarlierValue() {
        CellLedger ledger = new CellLedger();
        ledger.merge(CELL, List.of(source("WHO", CELL, 120.0, 0.95, Instant.parse("2025-01-20T00:00:00Z"))));

        List<SourceEstimate> merged = ledger.merge(CELL, List.of(
                SourceEstimate.missing("WHO", CELL, 0.95, Instant.parse("2025-01-25T00:00:00Z"))));

        assertEquals(1, merged.size());
        assertTrue(merged.get(0).usable());
    }

    @Test
    void evictionRemovesOlderBucketsOfTheSeriesOnly() {
        CellLedger ledger = new CellLedger();
        CellKey old = cell("US-CA", "influenza", "2025-W01");
        CellKey otherSeries = cell("US-TX", "influenza", "2025-W01");
        ledger.merge(old, List.of(source("WHO", old, 1.0, 1.0)));
        ledger.merge(otherSeries, List.of(source("WHO", otherSeries, 1.0, 1.0)));
        ledger.merge(CELL, List.of(source("WHO", CELL, 1.0, 1.0)));

        ledger.evictBefore(new SeriesKey("US-CA", "influenza"), TimeBucket.parse("2025-W02"));

        assertEquals(2, ledger.size());
        assertTrue(ledger.estimates(old).isEmpty());
        assertEquals(1, ledger.estimates(otherSeries).size());
    }
}
