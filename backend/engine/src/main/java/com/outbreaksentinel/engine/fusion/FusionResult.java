package com.outbreaksentinel.engine.fusion;

import java.util.List;

public record FusionResult(double mean, double variance, double agreement, List<String> warnings) {
    public FusionResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        variance = Math.max(0.0, variance);
        agreement = Math.max(0.0, Math.min(1.0, agreement));
    }

    public FusionResult(double mean, double variance, double agreement) {
        this(mean, variance, agreement, List.of());
    }
}
