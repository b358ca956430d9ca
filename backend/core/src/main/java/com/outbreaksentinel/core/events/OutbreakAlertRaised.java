package com.outbreaksentinel.core.events;

import com.outbreaksentinel.core.model.Alert;

import java.time.Instant;

public record OutbreakAlertRaised(
        Instant timestamp,
        Alert alert
) implements Event {
    @Override
    public String type() {
        return "OutbreakAlertRaised";
    }
}
