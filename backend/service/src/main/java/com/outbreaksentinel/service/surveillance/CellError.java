package com.outbreaksentinel.service.surveillance;

import com.outbreaksentinel.engine.pipeline.CellOutcome;

public record CellError(String cell, String error, String message) {
    static CellError of(CellOutcome outcome) {
        return new CellError(outcome.cell().toString(), outcome.errorCode(), outcome.message());
    }
}
