package com.outbreaksentinel.service.surveillance;

import com.outbreaksentinel.core.model.BucketRange;
import com.outbreaksentinel.core.model.FusedEstimate;

import java.util.List;
import java.util.Map;

/**
 * @param data newest fused estimate of the timeframe per region and disease
 */
public record AggregateResponse(
        int sourcesQueried,
        int sourcesSuccessful,
        int sourcesFailed,
        List<String> failedSources,
        Map<String, Map<String, FusedEstimate>> data,
        Metadata metadata,
        boolean partialData,
        boolean fallbackUsed,
        List<CellError> errors
) {
    /**
     * @param dataQualityScore mean overall quality of the queried sources
     * @param coveragePct      share of requested cells fused from at least one source, in percent
     */
    public record Metadata(
            double dataQualityScore,
            double coveragePct,
            String methodUsed,
            BucketRange timeframe,
            int normalizationErrors
    ) {
    }
}
