package com.outbreaksentinel.core.error;

/**
 * One source adapter failed (transport error, deadline, open circuit). Recovered locally by partial fusion.
 */
public class SourceUnavailableException extends SurveillanceException {
    private final String sourceId;

    public SourceUnavailableException(String sourceId, String message, Throwable cause) {
        super("source_unavailable", "Source " + sourceId + " unavailable: " + message, cause);
        this.sourceId = sourceId;
    }

    public String sourceId() {
        return sourceId;
    }
}
