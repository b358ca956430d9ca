package com.outbreaksentinel.core.events;

import java.time.Instant;

public record SourcePollCompleted(
        Instant timestamp,
        String sourceId,
        boolean success,
        long durationMillis,
        int estimates
) implements Event {
    @Override
    public String type() {
        return "SourcePollCompleted";
    }
}
