package com.outbreaksentinel.core.events;

import com.outbreaksentinel.core.model.Alert;

import java.time.Instant;

/**
 * Published when an open alert is closed on request. Replayed at startup so a resolved alert stays closed.
 */
public record AlertResolved(
        Instant timestamp,
        Alert alert
) implements Event {
    @Override
    public String type() {
        return "AlertResolved";
    }
}
