package com.outbreaksentinel.service.surveillance;

import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.engine.quality.SourceAnomaly;
import com.outbreaksentinel.engine.quality.SourceQuality;

import java.util.List;
import java.util.Map;

public record FuseResponse(
        String methodUsed,
        double confidenceScore,
        List<FusedEstimate> fusedData,
        List<SourceAnomaly> anomaliesDetected,
        Map<String, SourceQuality> qualityAssessment,
        List<String> sourcesUsed,
        List<String> sourcesExcluded,
        boolean partialData,
        boolean fallbackUsed,
        List<CellError> errors
) {
}
