package com.outbreaksentinel.engine.store;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.SeriesKey;
import com.outbreaksentinel.core.model.SourceEstimate;
import com.outbreaksentinel.core.model.TimeBucket;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest raw estimate per source for every cell, so a late correction from one source re-fuses a
 * bucket together with what the other sources reported earlier.
 */
public class CellLedger {
    private final Map<CellKey, Map<String, SourceEstimate>> cells = new ConcurrentHashMap<>();

    /**
     * Merges {@code estimates} into the cell and returns the cell's full per-source set.
     */
    public List<SourceEstimate> merge(CellKey cell, Collection<SourceEstimate> estimates) {
        Map<String, SourceEstimate> bySource = cells.computeIfAbsent(cell, ignored -> new ConcurrentHashMap<>());
        for (SourceEstimate estimate : estimates) {
            bySource.merge(estimate.sourceId(), estimate, CellLedger::newer);
        }
        return List.copyOf(bySource.values());
    }

    public List<SourceEstimate> estimates(CellKey cell) {
        Map<String, SourceEstimate> bySource = cells.get(cell);
        return bySource == null ? List.of() : List.copyOf(bySource.values());
    }

    public void evictBefore(SeriesKey series, TimeBucket oldestKept) {
        cells.keySet().removeIf(cell -> cell.series().equals(series)
                && cell.timeBucket().granularity() == oldestKept.granularity()
                && cell.timeBucket().isBefore(oldestKept));
    }

    public int size() {
        return cells.size();
    }

    private static SourceEstimate newer(SourceEstimate current, SourceEstimate candidate) {
        // a failed poll never erases a value the source reported earlier
        if (current.usable() && !candidate.usable()) {
            return current;
        }
        int byTime = candidate.observedAt().compareTo(current.observedAt());
        if (byTime != 0) {
            return byTime > 0 ? candidate : current;
        }
        return candidate.usable() || !current.usable() ? candidate : current;
    }
}
