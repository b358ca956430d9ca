package com.outbreaksentinel.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.outbreaksentinel.core.events.EstimateAppended;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.SeriesKey;
import com.outbreaksentinel.core.model.TimeBucket;
import com.outbreaksentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * JSON snapshot of the latest fused estimate per (region, disease, bucket). The whole document is
 * rewritten after every stored append; rows older than the retention horizon of their series are pruned.
 */
public class JsonFileEstimateStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileEstimateStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final int retentionBuckets;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<CellKey, FusedEstimate> rows = new ConcurrentHashMap<>();

    public JsonFileEstimateStore(Path file, int retentionBuckets) {
        this.file = file;
        this.retentionBuckets = Math.max(1, retentionBuckets);
        loadIfPresent();
    }

    public List<FusedEstimate> rows() {
        List<FusedEstimate> sorted = new ArrayList<>(rows.values());
        sorted.sort(Comparator.comparing((FusedEstimate row) -> row.seriesKey().toString())
                .thenComparing(FusedEstimate::timeBucket));
        return sorted;
    }

    public void onAppended(EstimateAppended event) {
        if (!event.outcome().stored()) {
            return;
        }
        put(event.estimate());
    }

    public void put(FusedEstimate estimate) {
        lock.lock();
        try {
            rows.put(estimate.cellKey(), estimate);
            prune(estimate.seriesKey());
            persist();
        } finally {
            lock.unlock();
        }
    }

    private void prune(SeriesKey series) {
        TimeBucket newest = null;
        for (CellKey key : rows.keySet()) {
            if (key.series().equals(series) && (newest == null || key.timeBucket().isAfter(newest))) {
                newest = key.timeBucket();
            }
        }
        if (newest == null) {
            return;
        }
        TimeBucket oldestKept = newest.plus(-(retentionBuckets - 1L));
        rows.keySet().removeIf(key -> key.series().equals(series)
                && key.timeBucket().granularity() == oldestKept.granularity()
                && key.timeBucket().isBefore(oldestKept));
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                EstimateSnapshotFile loaded = MAPPER.readValue(in, EstimateSnapshotFile.class);
                if (loaded.rows() != null) {
                    loaded.rows().forEach(row -> rows.put(row.cellKey(), row));
                }
            }
            LOGGER.info("Loaded " + rows.size() + " fused estimates from " + file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading estimates from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new EstimateSnapshotFile(rows()));
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing estimates to " + file, e);
        }
    }

    private record EstimateSnapshotFile(List<FusedEstimate> rows) {
    }
}
