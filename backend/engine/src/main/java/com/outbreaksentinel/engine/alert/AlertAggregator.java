package com.outbreaksentinel.engine.alert;

import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.model.BucketRange;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.core.model.RegionProfile;
import com.outbreaksentinel.core.model.SeriesKey;
import com.outbreaksentinel.core.model.Severity;
import com.outbreaksentinel.core.model.TimeBucket;
import com.outbreaksentinel.engine.config.EngineConfig;
import com.outbreaksentinel.engine.detection.DetectorSignal;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Merges the outbreak signals of one cell into at most one {@link Alert}.
 *
 * <p>Confidence is the probabilistic OR of the signal confidences. Severity is {@code high} when the
 * growth rate exceeds the configured bound or at least two methods agree, {@code moderate} for a
 * single method over poorly agreeing sources, and {@code low} otherwise. An open alert for the same
 * series suppresses new ones while the bucket under test is within the cooldown of the open alert's
 * detection bucket. Alerts are immutable; a later detection creates a new alert.
 */
public class AlertAggregator {
    private static final Logger LOGGER = Logger.getLogger(AlertAggregator.class.getName());

    private final EngineConfig.Alerting settings;
    private final Clock clock;
    private final AlertSink sink;
    private final Map<String, RegionProfile> regions;
    private final Map<SeriesKey, Alert> openAlerts = new ConcurrentHashMap<>();

    public AlertAggregator(EngineConfig config, Clock clock, AlertSink sink, Map<String, RegionProfile> regions) {
        this.settings = config.alerting();
        this.clock = clock;
        this.sink = sink;
        this.regions = Map.copyOf(regions);
    }

    /**
     * @param agreementScore source agreement of the cell's current fused estimate
     */
    public AggregationOutcome aggregate(CellKey cell, List<DetectorSignal> signals, double agreementScore) {
        List<DetectorSignal> outbreakSignals = signals.stream().filter(DetectorSignal::outbreak).toList();
        if (outbreakSignals.isEmpty()) {
            return AggregationOutcome.none();
        }

        AggregationOutcome[] outcome = new AggregationOutcome[1];
        openAlerts.compute(cell.series(), (series, open) -> {
            if (open != null && withinCooldown(open, cell.timeBucket())) {
                outcome[0] = AggregationOutcome.suppressed(open);
                return open;
            }
            Alert alert = merge(cell, outbreakSignals, agreementScore);
            outcome[0] = AggregationOutcome.emitted(alert);
            return alert;
        });

        if (outcome[0].suppressed()) {
            LOGGER.fine(() -> "Suppressed alert for " + cell + ": open alert " + outcome[0].suppressedBy().id());
            return outcome[0];
        }
        Alert alert = outcome[0].alert();
        LOGGER.info("Outbreak alert " + alert.id() + " for " + cell + " severity=" + alert.severity().wireName()
                + " methods=" + alert.methods());
        try {
            sink.emit(alert);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Alert sink failed for " + alert.id(), e);
        }
        return outcome[0];
    }

    public Optional<Alert> resolve(String region, String disease) {
        Alert removed = openAlerts.remove(new SeriesKey(region, disease));
        if (removed != null) {
            LOGGER.info("Resolved alert " + removed.id() + " for " + removed.seriesKey());
        }
        return Optional.ofNullable(removed);
    }

    public List<Alert> openAlerts() {
        List<Alert> open = new ArrayList<>(openAlerts.values());
        open.sort(Comparator.comparing(Alert::detectedAt).thenComparing(Alert::id));
        return open;
    }

    public Optional<Alert> openAlert(SeriesKey series) {
        return Optional.ofNullable(openAlerts.get(series));
    }

    /**
     * Reopens the most recent alert per series from an audit trail, e.g. after a restart.
     */
    public void restore(Collection<Alert> history) {
        for (Alert alert : history) {
            openAlerts.merge(alert.seriesKey(), alert, (current, candidate) ->
                    candidate.detectedAt().isAfter(current.detectedAt()) ? candidate : current);
        }
    }

    public void forget(Set<SeriesKey> resolved) {
        resolved.forEach(openAlerts::remove);
    }

    private boolean withinCooldown(Alert open, TimeBucket bucket) {
        if (open.detectedBucket().granularity() != bucket.granularity()) {
            return false;
        }
        return Math.abs(open.detectedBucket().bucketsUntil(bucket)) < settings.cooldownBuckets();
    }

    private Alert merge(CellKey cell, List<DetectorSignal> signals, double agreementScore) {
        Set<DetectionMethod> methods = EnumSet.noneOf(DetectionMethod.class);
        double notDetected = 1.0;
        Double growthRate = null;
        TimeBucket estimatedStart = null;
        BucketRange window = null;
        Long affectedPopulation = null;
        for (DetectorSignal signal : signals) {
            methods.add(signal.method());
            notDetected *= (1.0 - signal.confidence());
            if (signal.growthRate() != null && (growthRate == null || signal.growthRate() > growthRate)) {
                growthRate = signal.growthRate();
            }
            if (estimatedStart == null || signal.estimatedStart().isBefore(estimatedStart)) {
                estimatedStart = signal.estimatedStart();
            }
            window = window == null ? signal.window() : window.union(signal.window());
            if (signal.affectedPopulation() != null
                    && (affectedPopulation == null || signal.affectedPopulation() > affectedPopulation)) {
                affectedPopulation = signal.affectedPopulation();
            }
        }
        if (affectedPopulation == null && regions.containsKey(cell.region())) {
            affectedPopulation = regions.get(cell.region()).population();
        }

        return new Alert(
                UUID.randomUUID().toString(),
                cell.region(),
                cell.disease(),
                clock.instant(),
                cell.timeBucket(),
                window,
                methods,
                severity(methods.size(), growthRate, agreementScore),
                1.0 - notDetected,
                estimatedStart,
                growthRate,
                affectedPopulation
        );
    }

    Severity severity(int methodCount, Double growthRate, double agreementScore) {
        if ((growthRate != null && growthRate > settings.growthRateHigh()) || methodCount >= 2) {
            return Severity.HIGH;
        }
        if (methodCount == 1 && agreementScore < settings.agreementModerate()) {
            return Severity.MODERATE;
        }
        return Severity.LOW;
    }
}
