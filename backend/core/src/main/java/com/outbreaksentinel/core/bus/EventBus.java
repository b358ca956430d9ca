package com.outbreaksentinel.core.bus;

import com.outbreaksentinel.core.events.Event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process bus. Handlers run on the publishing thread in subscription order, so a handler
 * that publishes (detection raising an alert from an appended estimate) delivers the nested event before
 * the outer publish returns. A failing handler is reported to the error callback and never stops
 * delivery to the remaining handlers.
 *
 * <p>A typed subscription also receives subtypes of the subscribed class.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final List<Subscription<?>> subscriptions = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, error) -> LOGGER.log(Level.WARNING, "Handler for " + event.type() + " failed", error));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        subscriptions.add(new Subscription<>(type, handler));
    }

    public void subscribeAll(Consumer<Event> handler) {
        subscribe(Event.class, handler);
    }

    public void publish(Event event) {
        for (Subscription<?> subscription : subscriptions) {
            if (!subscription.type().isInstance(event)) {
                continue;
            }
            try {
                subscription.deliver(event);
            } catch (Exception e) {
                onHandlerError.accept(event, e);
            }
        }
    }

    private record Subscription<T extends Event>(Class<T> type, Consumer<T> handler) {
        private void deliver(Event event) {
            handler.accept(type.cast(event));
        }
    }
}
