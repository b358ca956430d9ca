package com.outbreaksentinel.core.error;

/**
 * Unknown fusion or detection method name. Maps to a 400 at the HTTP boundary.
 */
public class InvalidMethodException extends SurveillanceException {
    private final String kind;
    private final String requested;

    public InvalidMethodException(String kind, String requested) {
        super("invalid_method", "Unknown " + kind + " method: " + requested);
        this.kind = kind;
        this.requested = requested;
    }

    public String kind() {
        return kind;
    }

    public String requested() {
        return requested;
    }
}
