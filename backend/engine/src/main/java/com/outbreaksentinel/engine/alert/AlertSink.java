package com.outbreaksentinel.engine.alert;

import com.outbreaksentinel.core.model.Alert;

/**
 * Outbound notification interface. Delivery is fire-and-forget from the engine's point of view;
 * retries belong to the implementation.
 */
public interface AlertSink {
    String EVENT_NAME = "outbreak_alert";

    void emit(Alert alert);
}
