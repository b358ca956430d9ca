package com.outbreaksentinel.service.store;

import com.outbreaksentinel.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable log of every bus event, the audit trail for alerts and resolutions.
 */
public interface EventStore {
    void append(Event event);

    /**
     * @return the newest {@code limit} events at or after {@code since}, optionally of one type, oldest first
     */
    List<Event> query(Instant since, Optional<String> type, int limit);

    /**
     * Feeds every stored event to {@code consumer} in append order.
     */
    void replay(Consumer<Event> consumer);
}
