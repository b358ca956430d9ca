package com.outbreaksentinel.core.model;

public enum AppendOutcome {
    INSERTED,
    SUPERSEDED,
    LATE_REFUSED,
    DROPPED_OUTSIDE_HORIZON;

    public boolean stored() {
        return this != DROPPED_OUTSIDE_HORIZON;
    }
}
