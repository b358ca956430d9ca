package com.outbreaksentinel.collectors.api;

import com.outbreaksentinel.collectors.normalize.NormalizationError;
import com.outbreaksentinel.core.model.SourceEstimate;

import java.util.List;

/**
 * Fan-in of one poll across all selected sources. Failed sources contribute {@code missing} sentinels.
 */
public record FanOutResult(List<SourcePollResult> results) {
    public FanOutResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public List<SourceEstimate> estimates() {
        return results.stream().flatMap(result -> result.estimates().stream()).toList();
    }

    public List<NormalizationError> errors() {
        return results.stream().flatMap(result -> result.errors().stream()).toList();
    }

    public List<String> sourcesQueried() {
        return results.stream().map(SourcePollResult::sourceId).toList();
    }

    public List<String> successfulSources() {
        return results.stream().filter(SourcePollResult::success).map(SourcePollResult::sourceId).toList();
    }

    public List<String> failedSources() {
        return results.stream().filter(result -> !result.success()).map(SourcePollResult::sourceId).toList();
    }

    public boolean partial() {
        return !failedSources().isEmpty();
    }
}
