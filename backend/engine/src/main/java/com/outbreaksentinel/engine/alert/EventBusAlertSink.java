package com.outbreaksentinel.engine.alert;

import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.events.OutbreakAlertRaised;
import com.outbreaksentinel.core.model.Alert;

import java.time.Clock;

public class EventBusAlertSink implements AlertSink {
    private final EventBus eventBus;
    private final Clock clock;

    public EventBusAlertSink(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public void emit(Alert alert) {
        eventBus.publish(new OutbreakAlertRaised(clock.instant(), alert));
    }
}
