package com.outbreaksentinel.service.api;

import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.events.EstimateAppended;
import com.outbreaksentinel.core.events.OutbreakAlertRaised;
import com.outbreaksentinel.core.events.SourcePollCompleted;
import com.outbreaksentinel.core.events.SourcePollStarted;
import com.outbreaksentinel.core.events.WarningRaised;
import com.outbreaksentinel.core.model.AppendOutcome;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.service.support.ServiceFixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiagnosticsTrackerTest {
    private static final Instant AT = ServiceFixtures.NOW;

    @Test
    void countsEventsEstimatesAlertsAndWarnings() {
        EventBus bus = new EventBus();
        DiagnosticsTracker tracker = new DiagnosticsTracker(bus, ServiceFixtures.CLOCK, () -> 2, Map::of);
        FusedEstimate estimate = ServiceFixtures.estimate("US-CA", "influenza", "2025-W03", 120);

        bus.publish(new EstimateAppended(AT, estimate.cellKey(), estimate, AppendOutcome.INSERTED));
        bus.publish(new OutbreakAlertRaised(AT, ServiceFixtures.alert("a-1", "US-CA", "influenza", AT)));
        bus.publish(new WarningRaised(AT, WarningRaised.FUSION, "conflict", Map.of()));
        bus.publish(new WarningRaised(AT, WarningRaised.FUSION, "conflict", Map.of()));

        Map<String, Object> metrics = tracker.metricsSnapshot();
        assertEquals(2, metrics.get("sseClientsConnected"));
        assertEquals(4L, metrics.get("eventsEmittedTotal"));
        assertEquals(4, metrics.get("recentEventsPerMinute"));
        assertEquals(1L, metrics.get("estimatesAppendedTotal"));
        assertEquals(1L, metrics.get("alertsEmittedTotal"));
        assertEquals(Map.of("fusion", 2L), metrics.get("warnings"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void tracksPerSourceStatusAndCircuitState() {
        EventBus bus = new EventBus();
        DiagnosticsTracker tracker = new DiagnosticsTracker(bus, ServiceFixtures.CLOCK, () -> 0,
                () -> Map.of("cdc", "OPEN", "ecdc", "HALF_OPEN"));

        bus.publish(new SourcePollStarted(AT, "who"));
        bus.publish(new SourcePollCompleted(AT.plusMillis(40), "who", true, 40, 12));
        bus.publish(new SourcePollStarted(AT, "cdc"));
        bus.publish(new WarningRaised(AT, WarningRaised.SOURCE, "Source cdc unavailable: refused",
                Map.of("sourceId", "cdc", "error", "source_unavailable")));
        bus.publish(new SourcePollCompleted(AT.plusMillis(5), "cdc", false, 5, 0));

        Map<String, Object> sources = tracker.sourcesSnapshot();

        Map<String, Object> who = (Map<String, Object>) sources.get("who");
        assertEquals(true, who.get("lastSuccess"));
        assertEquals(12, who.get("lastEstimates"));
        assertEquals(40L, who.get("lastDurationMillis"));
        assertEquals(AT.plusMillis(40).toString(), who.get("lastSuccessAt"));
        assertEquals("CLOSED", who.get("circuitState"));
        assertNull(who.get("lastErrorMessage"));

        Map<String, Object> cdc = (Map<String, Object>) sources.get("cdc");
        assertEquals(false, cdc.get("lastSuccess"));
        assertEquals("OPEN", cdc.get("circuitState"));
        assertTrue(String.valueOf(cdc.get("lastErrorMessage")).contains("refused"));
        assertNull(cdc.get("lastSuccessAt"));

        Map<String, Object> ecdc = (Map<String, Object>) sources.get("ecdc");
        assertEquals("HALF_OPEN", ecdc.get("circuitState"));
        assertNull(ecdc.get("lastPollAt"));
    }

    @Test
    void emptyTrackerReportsZeroes() {
        Map<String, Object> metrics = DiagnosticsTracker.empty().metricsSnapshot();

        assertEquals(0L, metrics.get("eventsEmittedTotal"));
        assertEquals(Map.of(), metrics.get("sources"));
    }
}
