package com.outbreaksentinel.engine.pipeline;

import com.outbreaksentinel.core.model.AppendOutcome;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusedEstimate;

/**
 * Per-cell status of one ingest batch. A null {@code appendOutcome} on success means the stored
 * estimate was left unchanged.
 */
public record CellOutcome(
        CellKey cell,
        Status status,
        FusedEstimate estimate,
        AppendOutcome appendOutcome,
        String errorCode,
        String message
) {
    public enum Status {
        OK,
        ERROR
    }

    public static CellOutcome ok(CellKey cell, FusedEstimate estimate, AppendOutcome appendOutcome) {
        return new CellOutcome(cell, Status.OK, estimate, appendOutcome, null, null);
    }

    public static CellOutcome error(CellKey cell, String errorCode, String message) {
        return new CellOutcome(cell, Status.ERROR, null, null, errorCode, message);
    }

    public boolean ok() {
        return status == Status.OK;
    }
}
