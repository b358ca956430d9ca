package com.outbreaksentinel.core.events;

import com.outbreaksentinel.core.model.AppendOutcome;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusedEstimate;

import java.time.Instant;

/**
 * Published by the windowed store after every stored append.
 */
public record EstimateAppended(
        Instant timestamp,
        CellKey cellKey,
        FusedEstimate estimate,
        AppendOutcome outcome
) implements Event {
    @Override
    public String type() {
        return "EstimateAppended";
    }
}
