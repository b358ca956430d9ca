package com.outbreaksentinel.core.events;

import java.time.Instant;

public record SourcePollStarted(
        Instant timestamp,
        String sourceId
) implements Event {
    @Override
    public String type() {
        return "SourcePollStarted";
    }
}
