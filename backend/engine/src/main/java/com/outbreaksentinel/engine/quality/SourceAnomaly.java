package com.outbreaksentinel.engine.quality;

import com.outbreaksentinel.core.model.CellKey;

/**
 * A source value that stands out from what the other sources report for the same cell.
 *
 * @param expected mean of the other sources
 * @param severity {@code high} or {@code medium}
 */
public record SourceAnomaly(String sourceId, CellKey cell, double value, double expected, double zScore, String severity) {
}
