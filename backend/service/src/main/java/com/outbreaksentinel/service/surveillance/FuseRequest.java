package com.outbreaksentinel.service.surveillance;

import java.util.List;

/**
 * @param confidenceThreshold minimum overall source quality for a source to take part, 0.6 when absent
 */
public record FuseRequest(
        List<String> sources,
        String fusionMethod,
        Double confidenceThreshold,
        List<String> regions,
        List<String> diseases,
        String from,
        String to
) {
    public FuseRequest {
        sources = sources == null ? List.of() : List.copyOf(sources);
        regions = regions == null ? List.of() : List.copyOf(regions);
        diseases = diseases == null ? List.of() : List.copyOf(diseases);
    }
}
