package com.outbreaksentinel.core.error;

/**
 * Base type for the engine's error taxonomy. Every subtype carries a stable {@link #code()} that
 * batch responses and the HTTP layer surface to callers.
 */
public abstract class SurveillanceException extends RuntimeException {
    private final String code;

    protected SurveillanceException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected SurveillanceException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
