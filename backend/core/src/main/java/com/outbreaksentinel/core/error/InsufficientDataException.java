package com.outbreaksentinel.core.error;

import com.outbreaksentinel.core.model.CellKey;

public class InsufficientDataException extends SurveillanceException {
    private final CellKey cellKey;

    public InsufficientDataException(CellKey cellKey, String message) {
        super("insufficient_data", "No usable estimates for " + cellKey + ": " + message);
        this.cellKey = cellKey;
    }

    public CellKey cellKey() {
        return cellKey;
    }
}
