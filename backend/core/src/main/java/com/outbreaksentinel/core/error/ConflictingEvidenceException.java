package com.outbreaksentinel.core.error;

public class ConflictingEvidenceException extends SurveillanceException {
    private final double conflictMass;

    public ConflictingEvidenceException(double conflictMass) {
        super("conflicting_evidence", "Dempster-Shafer conflict mass " + conflictMass + " leaves no consistent belief");
        this.conflictMass = conflictMass;
    }

    public double conflictMass() {
        return conflictMass;
    }
}
