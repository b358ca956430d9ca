package com.outbreaksentinel.service.store;

import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.events.AlertResolved;
import com.outbreaksentinel.core.events.EstimateAppended;
import com.outbreaksentinel.core.events.Event;
import com.outbreaksentinel.core.events.OutbreakAlertRaised;
import com.outbreaksentinel.core.events.SourcePollStarted;
import com.outbreaksentinel.core.events.WarningRaised;
import com.outbreaksentinel.core.model.AppendOutcome;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.service.support.ServiceFixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventCodecTest {
    private static final Instant AT = Instant.parse("2025-01-22T12:00:00Z");

    @Test
    void writesEnvelopeAndReadsBackTypedEvent() {
        Event event = new OutbreakAlertRaised(AT, ServiceFixtures.alert("a-1", "US-CA", "influenza", AT));

        String line = EventCodec.toJsonLine(event);
        Event parsed = EventCodec.fromJsonLine(line);

        assertTrue(line.contains("\"type\":\"OutbreakAlertRaised\""));
        assertTrue(line.contains("\"timestamp\""));
        OutbreakAlertRaised raised = assertInstanceOf(OutbreakAlertRaised.class, parsed);
        assertEquals("a-1", raised.alert().id());
        assertEquals("US-CA", raised.alert().region());
        assertEquals(EventCodec.toJsonLine(event), EventCodec.toSseData(event));
    }

    @Test
    void estimateAppendedKeepsOutcomeAndEstimate() {
        FusedEstimate estimate = ServiceFixtures.estimate("US-NV", "influenza", "2025-W03", 42.5);
        Event event = new EstimateAppended(AT, estimate.cellKey(), estimate, AppendOutcome.SUPERSEDED);

        EstimateAppended parsed = assertInstanceOf(EstimateAppended.class,
                EventCodec.fromJsonLine(EventCodec.toJsonLine(event)));

        assertEquals(AppendOutcome.SUPERSEDED, parsed.outcome());
        assertEquals(42.5, parsed.estimate().mean(), 1e-9);
        assertEquals(estimate.cellKey(), parsed.cellKey());
    }

    @Test
    void rejectsUnsupportedOrInvalidPayload() {
        IllegalArgumentException unsupported = assertThrows(IllegalArgumentException.class, () ->
                EventCodec.fromJsonLine("{\"type\":\"Nope\",\"timestamp\":\"2025-01-22T12:00:00Z\",\"event\":{}}")
        );
        assertTrue(unsupported.getMessage().contains("Unsupported event type"));

        IllegalStateException invalid = assertThrows(IllegalStateException.class, () ->
                EventCodec.fromJsonLine("not-json")
        );
        assertTrue(invalid.getMessage().contains("Unable to deserialize event"));
    }

    @Test
    void knowsEveryPublishedType() {
        assertEquals(6, EventCodec.allEventTypes().size());
        assertTrue(EventCodec.knownType("AlertResolved"));
        assertTrue(EventCodec.knownType("WarningRaised"));
        assertFalse(EventCodec.knownType("AlertRaised"));
    }

    @Test
    void subscribeAllReceivesEachEventOnce() {
        EventBus bus = new EventBus();
        List<Event> received = new ArrayList<>();
        EventCodec.subscribeAll(bus, received::add);

        bus.publish(new SourcePollStarted(AT, "who"));
        bus.publish(new WarningRaised(AT, WarningRaised.SOURCE, "down", Map.of("sourceId", "who")));
        bus.publish(new AlertResolved(AT, ServiceFixtures.alert("a-2", "US-NY", "influenza", AT)));

        assertEquals(3, received.size());
        assertEquals("AlertResolved", received.get(2).type());
    }
}
