package com.outbreaksentinel.engine.pipeline;

import com.outbreaksentinel.core.model.FusedEstimate;

import java.util.List;

public record IngestReport(List<CellOutcome> cells) {
    public IngestReport {
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    public List<FusedEstimate> fused() {
        return cells.stream().filter(CellOutcome::ok).map(CellOutcome::estimate).toList();
    }

    public List<CellOutcome> errors() {
        return cells.stream().filter(outcome -> !outcome.ok()).toList();
    }

    public boolean partial() {
        return !errors().isEmpty();
    }
}
