package com.outbreaksentinel.engine.store;

import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.events.EstimateAppended;
import com.outbreaksentinel.core.model.AppendOutcome;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.SeriesKey;
import com.outbreaksentinel.core.model.TimeBucket;
import com.outbreaksentinel.engine.config.EngineConfig;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Rolling per-series buffer holding exactly one {@link FusedEstimate} per bucket, the latest one.
 *
 * <p>Each series has a single writer at a time: appends and {@link #withSeriesLock} sections take the
 * series lock. Readers never lock; they see an immutable snapshot that is replaced on every write.
 * Every stored append publishes {@link EstimateAppended} while the series lock is still held, so
 * subscribers observe appends of one series in order.
 */
public class WindowedSeriesStore {
    private static final Logger LOGGER = Logger.getLogger(WindowedSeriesStore.class.getName());

    private final int retentionBuckets;
    private final EventBus eventBus;
    private final Clock clock;
    private final Map<SeriesKey, SeriesState> series = new ConcurrentHashMap<>();

    public WindowedSeriesStore(EngineConfig.Store config, EventBus eventBus, Clock clock) {
        this.retentionBuckets = config.retentionBuckets();
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public int retentionBuckets() {
        return retentionBuckets;
    }

    public AppendOutcome append(CellKey cellKey, FusedEstimate estimate) {
        if (!estimate.cellKey().equals(cellKey)) {
            throw new IllegalArgumentException("Estimate for " + estimate.cellKey() + " appended to " + cellKey);
        }
        SeriesState state = state(cellKey.series());
        state.lock.lock();
        try {
            AppendOutcome outcome = state.put(estimate, retentionBuckets);
            if (outcome == AppendOutcome.DROPPED_OUTSIDE_HORIZON) {
                LOGGER.fine(() -> "Dropped " + cellKey + ": older than the " + retentionBuckets + "-bucket horizon");
                return outcome;
            }
            eventBus.publish(new EstimateAppended(clock.instant(), cellKey, estimate, outcome));
            return outcome;
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Runs {@code action} while holding the series lock, so a read-fuse-append sequence for one series
     * cannot interleave with another writer.
     */
    public <T> T withSeriesLock(SeriesKey key, Supplier<T> action) {
        SeriesState state = state(key);
        state.lock.lock();
        try {
            return action.get();
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Lazy view of the stored estimates with buckets in {@code [from, to]}. The view is fixed at call
     * time, can be iterated any number of times and never reflects later writes.
     */
    public Iterable<FusedEstimate> readWindow(SeriesKey key, TimeBucket from, TimeBucket to) {
        if (to.isBefore(from)) {
            return List.of();
        }
        SeriesState state = series.get(key);
        if (state == null) {
            return List.of();
        }
        NavigableMap<TimeBucket, FusedEstimate> window = state.snapshot.subMap(from, true, to, true);
        return () -> window.values().iterator();
    }

    public Iterable<FusedEstimate> readWindow(CellKey cellKey, TimeBucket from, TimeBucket to) {
        return readWindow(cellKey.series(), from, to);
    }

    public List<FusedEstimate> window(SeriesKey key, TimeBucket from, TimeBucket to) {
        List<FusedEstimate> values = new ArrayList<>();
        readWindow(key, from, to).forEach(values::add);
        return values;
    }

    public Optional<FusedEstimate> get(CellKey cellKey) {
        SeriesState state = series.get(cellKey.series());
        return state == null ? Optional.empty() : Optional.ofNullable(state.snapshot.get(cellKey.timeBucket()));
    }

    public Optional<FusedEstimate> latest(SeriesKey key) {
        SeriesState state = series.get(key);
        if (state == null || state.snapshot.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(state.snapshot.lastEntry().getValue());
    }

    /**
     * Latest stored estimate for a bucket strictly before the cell's bucket.
     */
    public Optional<FusedEstimate> latestBefore(CellKey cellKey) {
        SeriesState state = series.get(cellKey.series());
        if (state == null) {
            return Optional.empty();
        }
        Map.Entry<TimeBucket, FusedEstimate> entry = state.snapshot.lowerEntry(cellKey.timeBucket());
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    public Set<SeriesKey> seriesKeys() {
        Set<SeriesKey> keys = new TreeSet<>((a, b) -> a.toString().compareTo(b.toString()));
        series.forEach((key, state) -> {
            if (!state.snapshot.isEmpty()) {
                keys.add(key);
            }
        });
        return keys;
    }

    public List<FusedEstimate> rows() {
        List<FusedEstimate> rows = new ArrayList<>();
        for (SeriesKey key : seriesKeys()) {
            rows.addAll(series.get(key).snapshot.values());
        }
        return rows;
    }

    public int size() {
        return series.values().stream().mapToInt(state -> state.snapshot.size()).sum();
    }

    /**
     * Rehydrates persisted rows without publishing events. Rows beyond the horizon are dropped.
     */
    public int restore(Collection<FusedEstimate> rows) {
        int restored = 0;
        for (FusedEstimate row : rows) {
            SeriesState state = state(row.seriesKey());
            state.lock.lock();
            try {
                if (state.put(row, retentionBuckets).stored()) {
                    restored++;
                }
            } finally {
                state.lock.unlock();
            }
        }
        LOGGER.info("Restored " + restored + " fused estimates into " + seriesKeys().size() + " series");
        return restored;
    }

    private SeriesState state(SeriesKey key) {
        return series.computeIfAbsent(key, ignored -> new SeriesState());
    }

    private static final class SeriesState {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile NavigableMap<TimeBucket, FusedEstimate> snapshot = Collections.emptyNavigableMap();

        AppendOutcome put(FusedEstimate estimate, int retention) {
            TimeBucket bucket = estimate.timeBucket();
            NavigableMap<TimeBucket, FusedEstimate> current = snapshot;
            AppendOutcome outcome;
            if (current.isEmpty()) {
                outcome = AppendOutcome.INSERTED;
            } else {
                TimeBucket newest = current.lastKey();
                newest.requireSameGranularity(bucket);
                if (newest.bucketsUntil(bucket) <= -retention) {
                    return AppendOutcome.DROPPED_OUTSIDE_HORIZON;
                }
                if (bucket.isBefore(newest)) {
                    outcome = AppendOutcome.LATE_REFUSED;
                } else if (current.containsKey(bucket)) {
                    outcome = AppendOutcome.SUPERSEDED;
                } else {
                    outcome = AppendOutcome.INSERTED;
                }
            }
            TreeMap<TimeBucket, FusedEstimate> next = new TreeMap<>(current);
            next.put(bucket, estimate);
            TimeBucket oldestKept = next.lastKey().plus(-(retention - 1L));
            next.headMap(oldestKept, false).clear();
            snapshot = Collections.unmodifiableNavigableMap(next);
            return outcome;
        }
    }
}
