package com.outbreaksentinel.collectors.api;

import com.outbreaksentinel.collectors.normalize.NormalizationError;
import com.outbreaksentinel.core.model.SourceEstimate;

import java.util.List;

public record SourcePollResult(
        String sourceId,
        boolean success,
        long durationMillis,
        List<SourceEstimate> estimates,
        List<NormalizationError> errors,
        String failureMessage
) {
    public SourcePollResult {
        estimates = estimates == null ? List.of() : List.copyOf(estimates);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static SourcePollResult success(
            String sourceId,
            long durationMillis,
            List<SourceEstimate> estimates,
            List<NormalizationError> errors
    ) {
        return new SourcePollResult(sourceId, true, durationMillis, estimates, errors, null);
    }

    public static SourcePollResult failure(
            String sourceId,
            long durationMillis,
            List<SourceEstimate> sentinels,
            String failureMessage
    ) {
        return new SourcePollResult(sourceId, false, durationMillis, sentinels, List.of(), failureMessage);
    }
}
