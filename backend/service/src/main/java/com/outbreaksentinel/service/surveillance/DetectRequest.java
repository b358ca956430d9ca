package com.outbreaksentinel.service.surveillance;

import java.util.List;

/**
 * @param temporalWindow number of trailing buckets of each series to evaluate, 1 when absent
 * @param regions        regions to evaluate, empty for every stored series
 */
public record DetectRequest(
        List<String> detectionMethods,
        String sensitivity,
        Integer temporalWindow,
        List<String> regions,
        List<String> diseases
) {
    public DetectRequest {
        detectionMethods = detectionMethods == null ? List.of() : List.copyOf(detectionMethods);
        regions = regions == null ? List.of() : List.copyOf(regions);
        diseases = diseases == null ? List.of() : List.copyOf(diseases);
    }
}
