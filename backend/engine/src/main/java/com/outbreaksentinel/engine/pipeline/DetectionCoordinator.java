package com.outbreaksentinel.engine.pipeline;

import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.events.EstimateAppended;
import com.outbreaksentinel.core.events.WarningRaised;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.RegionProfile;
import com.outbreaksentinel.core.model.SeriesKey;
import com.outbreaksentinel.core.model.TimeBucket;
import com.outbreaksentinel.engine.alert.AggregationOutcome;
import com.outbreaksentinel.engine.alert.AlertAggregator;
import com.outbreaksentinel.engine.config.EngineConfig;
import com.outbreaksentinel.engine.detection.DetectionInput;
import com.outbreaksentinel.engine.detection.DetectorResult;
import com.outbreaksentinel.engine.detection.DetectorSignal;
import com.outbreaksentinel.engine.detection.OutbreakDetector;
import com.outbreaksentinel.engine.detection.SpatialCell;
import com.outbreaksentinel.engine.store.WindowedSeriesStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consumes {@link EstimateAppended} events and runs detection for the appended series at its newest
 * bucket, then hands the signals to the {@link AlertAggregator}. Detection runs on the appending
 * thread while the series lock is held, so one series is never evaluated concurrently with itself.
 *
 * <p>A region's spatial context is complete only once a whole batch is stored, so
 * {@link #onBatchFused(Collection)} re-runs the spatial scan for every located region of each
 * (disease, bucket) the batch wrote.
 *
 * <p>Each evaluation is its own error boundary: a failure is logged, published as a
 * {@link WarningRaised} and affects only that cell for that cycle.
 */
public class DetectionCoordinator {
    private static final Logger LOGGER = Logger.getLogger(DetectionCoordinator.class.getName());

    private final WindowedSeriesStore store;
    private final OutbreakDetector detector;
    private final AlertAggregator aggregator;
    private final Map<String, RegionProfile> regions;
    private final EventBus eventBus;
    private final Clock clock;
    private final Map<SeriesKey, DetectionReport> lastReports = new ConcurrentHashMap<>();

    public DetectionCoordinator(
            WindowedSeriesStore store,
            OutbreakDetector detector,
            AlertAggregator aggregator,
            Map<String, RegionProfile> regions,
            EventBus eventBus,
            Clock clock
    ) {
        this.store = store;
        this.detector = detector;
        this.aggregator = aggregator;
        this.regions = Map.copyOf(regions);
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public void subscribe() {
        eventBus.subscribe(EstimateAppended.class, this::onAppended);
    }

    void onAppended(EstimateAppended event) {
        SeriesKey series = event.cellKey().series();
        Optional<FusedEstimate> latest = store.latest(series);
        if (latest.isEmpty()) {
            return;
        }
        evaluate(latest.get().cellKey(), detector.settings(), true);
    }

    /**
     * Spatial pass over the buckets a finished ingest batch wrote. Only regions whose newest bucket is
     * the written one are evaluated, matching what detection on append would look at.
     */
    public void onBatchFused(Collection<CellKey> written) {
        EngineConfig.Detection settings = detector.settings();
        if (!settings.enabled(DetectionMethod.SPATIAL_SCAN)) {
            return;
        }
        EngineConfig.Detection spatialOnly = settings.withEnabledMethods(EnumSet.of(DetectionMethod.SPATIAL_SCAN));
        Set<String> passes = new LinkedHashSet<>();
        for (CellKey cell : written) {
            if (!regions.containsKey(cell.region()) || !passes.add(cell.disease() + "@" + cell.timeBucket())) {
                continue;
            }
            for (RegionProfile profile : regions.values()) {
                CellKey candidate = new CellKey(profile.region(), cell.disease(), cell.timeBucket());
                if (store.get(candidate).isEmpty()) {
                    continue;
                }
                store.withSeriesLock(candidate.series(), () -> {
                    boolean newest = store.latest(candidate.series())
                            .map(latest -> latest.timeBucket().equals(candidate.timeBucket()))
                            .orElse(false);
                    return newest ? evaluate(candidate, spatialOnly, false) : Optional.<DetectionReport>empty();
                });
            }
        }
    }

    /**
     * Detection at the newest bucket of every trailing {@code temporalWindow} bucket of the series that
     * holds an estimate, oldest first.
     */
    public List<DetectionReport> evaluateSeries(SeriesKey series, EngineConfig.Detection settings, int temporalWindow) {
        Optional<FusedEstimate> latest = store.latest(series);
        if (latest.isEmpty()) {
            return List.of();
        }
        TimeBucket newest = latest.get().timeBucket();
        TimeBucket from = newest.plus(-(Math.max(1, temporalWindow) - 1L));
        List<DetectionReport> reports = new ArrayList<>();
        for (FusedEstimate estimate : store.readWindow(series, from, newest)) {
            evaluateLocked(estimate.cellKey(), settings).ifPresent(reports::add);
        }
        return reports;
    }

    public Optional<DetectionReport> lastReport(SeriesKey series) {
        return Optional.ofNullable(lastReports.get(series));
    }

    public Map<SeriesKey, DetectionReport> lastReports() {
        return new LinkedHashMap<>(lastReports);
    }

    private Optional<DetectionReport> evaluateLocked(CellKey cell, EngineConfig.Detection settings) {
        return store.withSeriesLock(cell.series(), () -> evaluate(cell, settings, true));
    }

    private Optional<DetectionReport> evaluate(CellKey cell, EngineConfig.Detection settings, boolean record) {
        try {
            Optional<FusedEstimate> current = store.get(cell);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            TimeBucket oldest = cell.timeBucket().plus(-(store.retentionBuckets() - 1L));
            DetectionInput input = new DetectionInput(cell, store.window(cell.series(), oldest, cell.timeBucket()),
                    spatialCells(cell));
            List<DetectorResult> results = detector.detect(input, settings);
            List<DetectorSignal> signals = OutbreakDetector.signals(results);
            AggregationOutcome outcome = aggregator.aggregate(cell, signals, current.get().agreementScore());
            DetectionReport report = new DetectionReport(cell, results, outcome);
            report.anomalies().forEach(this::publishAnomaly);
            if (record) {
                lastReports.put(cell.series(), report);
            }
            return Optional.of(report);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Detection failed for " + cell, e);
            eventBus.publish(new WarningRaised(
                    clock.instant(),
                    WarningRaised.DETECTION,
                    "Detection failed for " + cell + ": " + e.getMessage(),
                    Map.of("cell", cell.toString(), "error", e.getClass().getSimpleName())
            ));
            return Optional.empty();
        }
    }

    private List<SpatialCell> spatialCells(CellKey cell) {
        List<SpatialCell> cells = new ArrayList<>();
        for (RegionProfile profile : regions.values()) {
            store.get(new CellKey(profile.region(), cell.disease(), cell.timeBucket()))
                    .ifPresent(estimate -> cells.add(new SpatialCell(profile, estimate.mean())));
        }
        cells.sort((a, b) -> a.region().region().compareTo(b.region().region()));
        return cells;
    }

    private void publishAnomaly(DetectorSignal signal) {
        LOGGER.info("Decrease anomaly " + signal.method().wireName() + " for " + signal.cell());
        eventBus.publish(new WarningRaised(
                clock.instant(),
                WarningRaised.DETECTION,
                "Significant decrease detected by " + signal.method().wireName(),
                Map.of(
                        "cell", signal.cell().toString(),
                        "method", signal.method().wireName(),
                        "statistic", signal.statistic(),
                        "threshold", signal.threshold()
                )
        ));
    }
}
