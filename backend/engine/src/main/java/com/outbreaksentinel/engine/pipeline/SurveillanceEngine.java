package com.outbreaksentinel.engine.pipeline;

import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.error.SurveillanceException;
import com.outbreaksentinel.core.events.WarningRaised;
import com.outbreaksentinel.core.model.AppendOutcome;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.core.model.SeriesKey;
import com.outbreaksentinel.core.model.SourceEstimate;
import com.outbreaksentinel.core.model.TimeBucket;
import com.outbreaksentinel.engine.config.EngineConfig;
import com.outbreaksentinel.engine.fusion.FusionEngine;
import com.outbreaksentinel.engine.store.CellLedger;
import com.outbreaksentinel.engine.store.WindowedSeriesStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns normalized source estimates into stored fused estimates.
 *
 * <p>Series are processed in parallel on a bounded worker pool; the cells of one series run in bucket
 * order on one task. Ledger merge, fusion against the previous bucket's estimate and the store append
 * form one critical section under the series lock. A failing cell is reported in the
 * {@link IngestReport} and never aborts the rest of the batch.
 */
public class SurveillanceEngine implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(SurveillanceEngine.class.getName());
    static final String INTERNAL_ERROR = "internal_error";

    private final FusionEngine fusionEngine;
    private final WindowedSeriesStore store;
    private final CellLedger ledger;
    private final EventBus eventBus;
    private final Clock clock;
    private final ExecutorService workers;
    private final List<Consumer<List<CellKey>>> batchListeners = new CopyOnWriteArrayList<>();

    public SurveillanceEngine(
            EngineConfig config,
            FusionEngine fusionEngine,
            WindowedSeriesStore store,
            CellLedger ledger,
            EventBus eventBus,
            Clock clock
    ) {
        this(fusionEngine, store, ledger, eventBus, clock,
                Executors.newFixedThreadPool(config.workers().cellWorkers(), namedThreads("cell-worker")));
    }

    public SurveillanceEngine(
            FusionEngine fusionEngine,
            WindowedSeriesStore store,
            CellLedger ledger,
            EventBus eventBus,
            Clock clock,
            ExecutorService workers
    ) {
        this.fusionEngine = fusionEngine;
        this.store = store;
        this.ledger = ledger;
        this.eventBus = eventBus;
        this.clock = clock;
        this.workers = workers;
    }

    public WindowedSeriesStore store() {
        return store;
    }

    public CellLedger ledger() {
        return ledger;
    }

    public FusionEngine fusionEngine() {
        return fusionEngine;
    }

    /**
     * Registers a callback that receives the cells stored by each finished ingest batch.
     */
    public void addBatchListener(Consumer<List<CellKey>> listener) {
        batchListeners.add(listener);
    }

    public IngestReport ingest(Collection<SourceEstimate> estimates) {
        return ingest(estimates, List.of(), null);
    }

    /**
     * @param expectedCells cells the caller asked for; those without any estimate are carried forward
     *                      from the series' previous bucket
     * @param method        fusion method, or {@code null} for the configured default
     */
    public IngestReport ingest(Collection<SourceEstimate> estimates, Collection<CellKey> expectedCells, FusionMethod method) {
        return ingest(estimates, expectedCells, method, null);
    }

    /**
     * Same as {@link #ingest(Collection, Collection, FusionMethod)}, but each cell is fused from the
     * ledger entries of {@code onlySources} alone. Other sources stay in the ledger untouched.
     *
     * @param onlySources source ids allowed into the fusion, or {@code null} for every source
     */
    public IngestReport ingest(
            Collection<SourceEstimate> estimates,
            Collection<CellKey> expectedCells,
            FusionMethod method,
            Set<String> onlySources
    ) {
        Map<SeriesKey, NavigableMap<TimeBucket, List<SourceEstimate>>> bySeries = new HashMap<>();
        for (CellKey cell : expectedCells) {
            cellsOf(bySeries, cell);
        }
        for (SourceEstimate estimate : estimates) {
            cellsOf(bySeries, estimate.cellKey()).add(estimate);
        }

        List<CompletableFuture<List<CellOutcome>>> futures = new ArrayList<>();
        bySeries.forEach((series, cells) -> futures.add(
                CompletableFuture.supplyAsync(() -> processSeries(series, cells, method, onlySources), workers)));

        List<CellOutcome> outcomes = new ArrayList<>();
        futures.forEach(future -> outcomes.addAll(future.join()));
        outcomes.sort(Comparator.comparing(outcome -> outcome.cell().toString()));
        IngestReport report = new IngestReport(outcomes);
        LOGGER.info("Ingested " + estimates.size() + " estimates into " + report.fused().size() + " cells"
                + (report.partial() ? " (" + report.errors().size() + " cells failed)" : ""));
        notifyBatch(outcomes);
        return report;
    }

    /**
     * Fuses a cell with an explicit estimate set without touching the ledger or the store.
     */
    public FusedEstimate preview(CellKey cell, List<SourceEstimate> estimates, FusionMethod method) {
        FusedEstimate prior = store.latestBefore(cell).orElse(null);
        return fusionEngine.fuse(cell, estimates, method, prior);
    }

    private List<CellOutcome> processSeries(
            SeriesKey series,
            NavigableMap<TimeBucket, List<SourceEstimate>> cells,
            FusionMethod method,
            Set<String> onlySources
    ) {
        List<CellOutcome> outcomes = new ArrayList<>();
        for (Map.Entry<TimeBucket, List<SourceEstimate>> entry : cells.entrySet()) {
            outcomes.add(processCell(series.at(entry.getKey()), entry.getValue(), method, onlySources));
        }
        return outcomes;
    }

    private CellOutcome processCell(
            CellKey cell,
            List<SourceEstimate> estimates,
            FusionMethod method,
            Set<String> onlySources
    ) {
        try {
            return store.withSeriesLock(cell.series(), () -> {
                List<SourceEstimate> merged = estimates.isEmpty() ? ledger.estimates(cell) : ledger.merge(cell, estimates);
                if (merged.isEmpty()) {
                    // nothing new and nothing to re-fuse: keep what is stored
                    Optional<FusedEstimate> stored = store.get(cell);
                    if (stored.isPresent()) {
                        return CellOutcome.ok(cell, stored.get(), null);
                    }
                }
                List<SourceEstimate> fusable = onlySources == null
                        ? merged
                        : merged.stream().filter(estimate -> onlySources.contains(estimate.sourceId())).toList();
                FusedEstimate prior = store.latestBefore(cell).orElse(null);
                FusedEstimate fused = fusionEngine.fuse(cell, fusable, method, prior);
                AppendOutcome outcome = store.append(cell, fused);
                store.latest(cell.series()).ifPresent(latest -> ledger.evictBefore(
                        cell.series(), latest.timeBucket().plus(-(store.retentionBuckets() - 1L))));
                return CellOutcome.ok(cell, fused, outcome);
            });
        } catch (SurveillanceException e) {
            LOGGER.warning("Cell " + cell + " failed: " + e.getMessage());
            warn(cell, e.code(), e.getMessage());
            return CellOutcome.error(cell, e.code(), e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Cell " + cell + " failed unexpectedly", e);
            warn(cell, INTERNAL_ERROR, String.valueOf(e.getMessage()));
            return CellOutcome.error(cell, INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void notifyBatch(List<CellOutcome> outcomes) {
        List<CellKey> written = outcomes.stream()
                .filter(outcome -> outcome.ok() && outcome.appendOutcome() != null && outcome.appendOutcome().stored())
                .map(CellOutcome::cell)
                .toList();
        if (written.isEmpty()) {
            return;
        }
        for (Consumer<List<CellKey>> listener : batchListeners) {
            try {
                listener.accept(written);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Batch listener failed for " + written.size() + " cells", e);
            }
        }
    }

    private void warn(CellKey cell, String code, String message) {
        eventBus.publish(new WarningRaised(
                clock.instant(),
                WarningRaised.FUSION,
                message,
                Map.of("cell", cell.toString(), "error", code)
        ));
    }

    private static List<SourceEstimate> cellsOf(
            Map<SeriesKey, NavigableMap<TimeBucket, List<SourceEstimate>>> bySeries,
            CellKey cell
    ) {
        return bySeries.computeIfAbsent(cell.series(), ignored -> new TreeMap<>())
                .computeIfAbsent(cell.timeBucket(), ignored -> new ArrayList<>());
    }

    public static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}
