package com.outbreaksentinel.engine.store;

import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.events.EstimateAppended;
import com.outbreaksentinel.core.model.AppendOutcome;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.SeriesKey;
import com.outbreaksentinel.core.model.TimeBucket;
import com.outbreaksentinel.engine.config.EngineConfig;
import com.outbreaksentinel.engine.support.EventCapture;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.outbreaksentinel.engine.support.Estimates.cell;
import static com.outbreaksentinel.engine.support.Estimates.fused;
import static com.outbreaksentinel.engine.support.Estimates.series;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WindowedSeriesStoreTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T00:00:00Z"), ZoneOffset.UTC);
    private static final SeriesKey SERIES = new SeriesKey("US-CA", "influenza");

    @Test
    void appendPublishesOutcomeAndKeepsOneEstimatePerBucket() {
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        WindowedSeriesStore store = new WindowedSeriesStore(EngineConfig.Store.defaults(), bus, CLOCK);
        CellKey w3 = cell("US-CA", "influenza", "2025-W03");
        CellKey w4 = cell("US-CA", "influenza", "2025-W04");

        assertEquals(AppendOutcome.INSERTED, store.append(w3, fused(w3, 100.0)));
        assertEquals(AppendOutcome.INSERTED, store.append(w4, fused(w4, 110.0)));
        assertEquals(AppendOutcome.SUPERSEDED, store.append(w4, fused(w4, 115.0)));
        assertEquals(AppendOutcome.LATE_REFUSED, store.append(w3, fused(w3, 105.0)));

        assertEquals(2, store.size());
        assertEquals(105.0, store.get(w3).orElseThrow().mean(), 1e-12);
        assertEquals(115.0, store.latest(SERIES).orElseThrow().mean(), 1e-12);
        List<EstimateAppended> events = capture.byType(EstimateAppended.class);
        assertEquals(4, events.size());
        assertEquals(AppendOutcome.LATE_REFUSED, events.get(3).outcome());
        assertEquals(w3, events.get(3).cellKey());
    }

    @Test
    void retentionHorizonEvictsAndDropsOldBuckets() {
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        WindowedSeriesStore store = new WindowedSeriesStore(new EngineConfig.Store(3), bus, CLOCK);
        for (FusedEstimate estimate : series("US-CA", "influenza", TimeBucket.parse("2025-01-01"), 1, 2, 3, 4, 5)) {
            store.append(estimate.cellKey(), estimate);
        }

        List<FusedEstimate> kept = store.window(SERIES, TimeBucket.parse("2024-12-01"), TimeBucket.parse("2025-02-01"));
        assertEquals(List.of(3.0, 4.0, 5.0), kept.stream().map(FusedEstimate::mean).toList());

        CellKey tooOld = cell("US-CA", "influenza", "2025-01-02");
        assertEquals(AppendOutcome.DROPPED_OUTSIDE_HORIZON, store.append(tooOld, fused(tooOld, 99.0)));
        assertEquals(5, capture.byType(EstimateAppended.class).size());
        assertTrue(store.get(tooOld).isEmpty());
    }

    @Test
    void readWindowIsLazySnapshotAndRestartable() {
        WindowedSeriesStore store = new WindowedSeriesStore(EngineConfig.Store.defaults(), new EventBus(), CLOCK);
        for (FusedEstimate estimate : series("US-CA", "influenza", TimeBucket.parse("2025-W01"), 10, 20, 30)) {
            store.append(estimate.cellKey(), estimate);
        }

        Iterable<FusedEstimate> window = store.readWindow(SERIES, TimeBucket.parse("2025-W02"), TimeBucket.parse("2025-W09"));
        CellKey w4 = cell("US-CA", "influenza", "2025-W04");
        store.append(w4, fused(w4, 40.0));

        List<Double> first = new ArrayList<>();
        window.forEach(estimate -> first.add(estimate.mean()));
        List<Double> second = new ArrayList<>();
        window.forEach(estimate -> second.add(estimate.mean()));
        assertEquals(List.of(20.0, 30.0), first);
        assertEquals(first, second);
        assertFalse(store.readWindow(SERIES, TimeBucket.parse("2025-W09"), TimeBucket.parse("2025-W01")).iterator().hasNext());
    }

    @Test
    void latestBeforeSkipsTheCellItself() {
        WindowedSeriesStore store = new WindowedSeriesStore(EngineConfig.Store.defaults(), new EventBus(), CLOCK);
        for (FusedEstimate estimate : series("US-CA", "influenza", TimeBucket.parse("2025-W01"), 10, 20)) {
            store.append(estimate.cellKey(), estimate);
        }

        assertEquals(10.0, store.latestBefore(cell("US-CA", "influenza", "2025-W02")).orElseThrow().mean(), 1e-12);
        assertEquals(20.0, store.latestBefore(cell("US-CA", "influenza", "2025-W07")).orElseThrow().mean(), 1e-12);
        assertTrue(store.latestBefore(cell("US-CA", "influenza", "2025-W01")).isEmpty());
    }

    @Test
    void restoreDoesNotPublish() {
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        WindowedSeriesStore store = new WindowedSeriesStore(EngineConfig.Store.defaults(), bus, CLOCK);

        int restored = store.restore(series("US-CA", "influenza", TimeBucket.parse("2025-W01"), 1, 2, 3));

        assertEquals(3, restored);
        assertEquals(3, store.rows().size());
        assertTrue(capture.byType(EstimateAppended.class).isEmpty());
    }

    @Test
    void mismatchedCellAndGranularityAreRejected() {
        WindowedSeriesStore store = new WindowedSeriesStore(EngineConfig.Store.defaults(), new EventBus(), CLOCK);
        CellKey week = cell("US-CA", "influenza", "2025-W01");
        CellKey day = cell("US-CA", "influenza", "2025-01-08");
        store.append(week, fused(week, 1.0));

        assertThrows(IllegalArgumentException.class, () -> store.append(week, fused(day, 1.0)));
        assertThrows(IllegalArgumentException.class, () -> store.append(day, fused(day, 1.0)));
    }

    @Test
    void concurrentWritersOfOneSeriesNeverInterleave() throws Exception {
        WindowedSeriesStore store = new WindowedSeriesStore(EngineConfig.Store.defaults(), new EventBus(), CLOCK);
        CellKey cell = cell("US-CA", "influenza", "2025-W01");
        store.append(cell, fused(cell, 0.0));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.withSeriesLock(cell.series(), () -> {
                        double current = store.get(cell).orElseThrow().mean();
                        return store.append(cell, fused(cell, current + 1.0));
                    });
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(200.0, store.get(cell).orElseThrow().mean(), 1e-12);
    }
}
