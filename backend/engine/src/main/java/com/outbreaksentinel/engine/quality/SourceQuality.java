package com.outbreaksentinel.engine.quality;

/**
 * Quality scores of one source for one request, each within [0, 1].
 */
public record SourceQuality(
        String sourceId,
        double completeness,
        double timeliness,
        double consistency,
        double reliability,
        double overallQuality,
        String grade
) {
}
