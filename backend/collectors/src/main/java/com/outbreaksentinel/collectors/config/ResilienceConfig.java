package com.outbreaksentinel.collectors.config;

import java.time.Duration;

/**
 * Circuit breaker and retry settings applied to every source.
 *
 * @param failureThreshold consecutive failures that open a source's circuit
 * @param openCooldown     time an open circuit rejects calls before a half-open trial call
 * @param maxAttempts      total attempts per call, first try included
 * @param initialBackoff   first retry delay; later delays grow exponentially with jitter
 */
public record ResilienceConfig(
        int failureThreshold,
        Duration openCooldown,
        int maxAttempts,
        Duration initialBackoff
) {
    public static final int MAX_ATTEMPTS_CAP = 3;

    public ResilienceConfig {
        failureThreshold = failureThreshold <= 0 ? 5 : failureThreshold;
        openCooldown = openCooldown == null ? Duration.ofSeconds(60) : openCooldown;
        maxAttempts = maxAttempts <= 0 ? MAX_ATTEMPTS_CAP : Math.min(maxAttempts, MAX_ATTEMPTS_CAP);
        initialBackoff = initialBackoff == null ? Duration.ofMillis(200) : initialBackoff;
    }

    public static ResilienceConfig defaults() {
        return new ResilienceConfig(5, Duration.ofSeconds(60), MAX_ATTEMPTS_CAP, Duration.ofMillis(200));
    }
}
