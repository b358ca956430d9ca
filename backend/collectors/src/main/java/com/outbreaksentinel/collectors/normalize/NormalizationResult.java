package com.outbreaksentinel.collectors.normalize;

import com.outbreaksentinel.core.model.SourceEstimate;

import java.util.List;

public record NormalizationResult(List<SourceEstimate> estimates, List<NormalizationError> errors) {
    public NormalizationResult {
        estimates = estimates == null ? List.of() : List.copyOf(estimates);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
