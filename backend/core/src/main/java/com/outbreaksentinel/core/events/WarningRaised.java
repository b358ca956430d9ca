package com.outbreaksentinel.core.events;

import java.time.Instant;
import java.util.Map;

public record WarningRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public static final String SOURCE = "source";
    public static final String NORMALIZATION = "normalization";
    public static final String FUSION = "fusion";
    public static final String DETECTION = "detection";
    public static final String SCHEDULER = "scheduler";

    @Override
    public String type() {
        return "WarningRaised";
    }
}
