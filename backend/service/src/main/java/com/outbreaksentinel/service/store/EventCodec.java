package com.outbreaksentinel.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.events.AlertResolved;
import com.outbreaksentinel.core.events.EstimateAppended;
import com.outbreaksentinel.core.events.Event;
import com.outbreaksentinel.core.events.OutbreakAlertRaised;
import com.outbreaksentinel.core.events.SourcePollCompleted;
import com.outbreaksentinel.core.events.SourcePollStarted;
import com.outbreaksentinel.core.events.WarningRaised;
import com.outbreaksentinel.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Envelope codec shared by the JSONL log and the SSE stream: {@code {"type", "timestamp", "event"}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "SourcePollStarted", SourcePollStarted.class,
            "SourcePollCompleted", SourcePollCompleted.class,
            "EstimateAppended", EstimateAppended.class,
            "OutbreakAlertRaised", OutbreakAlertRaised.class,
            "AlertResolved", AlertResolved.class,
            "WarningRaised", WarningRaised.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static boolean knownType(String type) {
        return TYPES.containsKey(type);
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    public static String toSseData(Event event) {
        return toJsonLine(event);
    }

    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        for (Class<? extends Event> type : TYPES.values()) {
            subscribe(bus, type, consumer);
        }
    }

    private static <T extends Event> void subscribe(EventBus bus, Class<T> type, Consumer<Event> consumer) {
        bus.subscribe(type, consumer::accept);
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
