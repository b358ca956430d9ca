package com.outbreaksentinel.service.surveillance;

import java.util.List;

/**
 * @param sources sources to poll, empty for every enabled source
 * @param from    first bucket of the timeframe, e.g. {@code 2025-W03}; defaults to the current bucket
 * @param to      last bucket of the timeframe; defaults to {@code from}
 * @param method  fusion method wire name, null for the configured default
 */
public record AggregateRequest(
        List<String> sources,
        List<String> regions,
        List<String> diseases,
        String from,
        String to,
        String method
) {
    public AggregateRequest {
        sources = sources == null ? List.of() : List.copyOf(sources);
        regions = regions == null ? List.of() : List.copyOf(regions);
        diseases = diseases == null ? List.of() : List.copyOf(diseases);
    }
}
