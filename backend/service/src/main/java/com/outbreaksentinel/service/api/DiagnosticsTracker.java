package com.outbreaksentinel.service.api;

import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.events.EstimateAppended;
import com.outbreaksentinel.core.events.Event;
import com.outbreaksentinel.core.events.OutbreakAlertRaised;
import com.outbreaksentinel.core.events.SourcePollCompleted;
import com.outbreaksentinel.core.events.SourcePollStarted;
import com.outbreaksentinel.core.events.WarningRaised;
import com.outbreaksentinel.service.store.EventCodec;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

/**
 * Event-driven counters for the metrics and source status endpoints.
 */
public final class DiagnosticsTracker {
    private final Clock clock;
    private final IntSupplier sseClientCountSupplier;
    private final Supplier<Map<String, String>> circuitStates;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final LongAdder estimatesAppendedTotal = new LongAdder();
    private final LongAdder alertsEmittedTotal = new LongAdder();
    private final ConcurrentHashMap<String, LongAdder> warningsByCategory = new ConcurrentHashMap<>();
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<String, SourceStatus> sourceStatuses = new ConcurrentHashMap<>();

    public DiagnosticsTracker(
            EventBus eventBus,
            Clock clock,
            IntSupplier sseClientCountSupplier,
            Supplier<Map<String, String>> circuitStates
    ) {
        this(clock, sseClientCountSupplier, circuitStates);
        EventCodec.subscribeAll(eventBus, this::onAnyEvent);
        eventBus.subscribe(SourcePollStarted.class, this::onPollStarted);
        eventBus.subscribe(SourcePollCompleted.class, this::onPollCompleted);
        eventBus.subscribe(WarningRaised.class, this::onWarning);
        eventBus.subscribe(EstimateAppended.class, event -> estimatesAppendedTotal.increment());
        eventBus.subscribe(OutbreakAlertRaised.class, event -> alertsEmittedTotal.increment());
    }

    private DiagnosticsTracker(Clock clock, IntSupplier sseClientCountSupplier, Supplier<Map<String, String>> circuitStates) {
        this.clock = clock;
        this.sseClientCountSupplier = sseClientCountSupplier;
        this.circuitStates = circuitStates;
    }

    public static DiagnosticsTracker empty() {
        return new DiagnosticsTracker(Clock.systemUTC(), () -> 0, Map::of);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> warnings = new TreeMap<>();
        warningsByCategory.forEach((category, count) -> warnings.put(category, count.longValue()));

        Map<String, Object> metrics = new HashMap<>();
        metrics.put("sseClientsConnected", sseClientCountSupplier.getAsInt());
        metrics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        metrics.put("estimatesAppendedTotal", estimatesAppendedTotal.longValue());
        metrics.put("alertsEmittedTotal", alertsEmittedTotal.longValue());
        metrics.put("warnings", warnings);
        metrics.put("sources", sourcesSnapshot());
        return metrics;
    }

    public Map<String, Object> sourcesSnapshot() {
        Map<String, String> circuits = circuitStates.get();
        Map<String, Object> sources = new TreeMap<>();
        for (Map.Entry<String, SourceStatus> entry : sourceStatuses.entrySet()) {
            sources.put(entry.getKey(), entry.getValue().toMap(circuits.get(entry.getKey())));
        }
        for (Map.Entry<String, String> circuit : circuits.entrySet()) {
            sources.computeIfAbsent(circuit.getKey(), id -> SourceStatus.empty().toMap(circuit.getValue()));
        }
        return sources;
    }

    private void onAnyEvent(Event event) {
        eventsEmittedTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty()) {
            Instant first = recentEventTimestamps.peekFirst();
            if (first != null && first.isBefore(threshold)) {
                recentEventTimestamps.removeFirst();
            } else {
                break;
            }
        }
    }

    private void onPollStarted(SourcePollStarted event) {
        sourceStatuses.compute(event.sourceId(), (id, current) -> orEmpty(current).withLastPollAt(event.timestamp()));
    }

    private void onPollCompleted(SourcePollCompleted event) {
        sourceStatuses.compute(event.sourceId(), (id, current) -> orEmpty(current).withCompletion(
                event.timestamp(), event.durationMillis(), event.success(), event.estimates()));
    }

    private void onWarning(WarningRaised event) {
        warningsByCategory.computeIfAbsent(event.category(), ignored -> new LongAdder()).increment();
        if (!WarningRaised.SOURCE.equals(event.category()) || event.details() == null) {
            return;
        }
        Object source = event.details().get("sourceId");
        if (!(source instanceof String sourceId) || sourceId.isBlank()) {
            return;
        }
        sourceStatuses.compute(sourceId, (id, current) -> orEmpty(current).withLastErrorMessage(event.message()));
    }

    private static SourceStatus orEmpty(SourceStatus status) {
        return status == null ? SourceStatus.empty() : status;
    }

    private record SourceStatus(
            Instant lastPollAt,
            Long lastDurationMillis,
            Boolean lastSuccess,
            Integer lastEstimates,
            Instant lastSuccessAt,
            String lastErrorMessage
    ) {
        private static SourceStatus empty() {
            return new SourceStatus(null, null, null, null, null, null);
        }

        private SourceStatus withLastPollAt(Instant pollAt) {
            return new SourceStatus(pollAt, lastDurationMillis, lastSuccess, lastEstimates, lastSuccessAt, lastErrorMessage);
        }

        private SourceStatus withCompletion(Instant at, long durationMillis, boolean success, int estimates) {
            return new SourceStatus(at, durationMillis, success, estimates,
                    success ? at : lastSuccessAt, success ? null : lastErrorMessage);
        }

        private SourceStatus withLastErrorMessage(String message) {
            return new SourceStatus(lastPollAt, lastDurationMillis, lastSuccess, lastEstimates, lastSuccessAt, message);
        }

        private Map<String, Object> toMap(String circuitState) {
            Map<String, Object> map = new HashMap<>();
            map.put("lastPollAt", lastPollAt == null ? null : lastPollAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            map.put("lastEstimates", lastEstimates);
            map.put("lastSuccessAt", lastSuccessAt == null ? null : lastSuccessAt.toString());
            map.put("lastErrorMessage", lastErrorMessage);
            map.put("circuitState", circuitState == null ? "CLOSED" : circuitState);
            return map;
        }
    }
}
