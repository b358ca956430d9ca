package com.outbreaksentinel.collectors.resilience;

import com.outbreaksentinel.collectors.config.ResilienceConfig;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Per-source circuit breaker and retry. A circuit opens after {@code failureThreshold} consecutive
 * failed calls and lets one trial call through once the cooldown has elapsed. Calls rejected by an open
 * circuit are not retried.
 */
public class ResilientSourceCaller {
    private static final Logger LOGGER = Logger.getLogger(ResilientSourceCaller.class.getName());
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final double JITTER = 0.5;

    private final CircuitBreakerConfig breakerConfig;
    private final RetryConfig retryConfig;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Map<String, Retry> retries = new ConcurrentHashMap<>();

    public ResilientSourceCaller(ResilienceConfig config) {
        this.breakerConfig = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(config.failureThreshold())
                .minimumNumberOfCalls(config.failureThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(config.openCooldown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .build();
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(config.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        config.initialBackoff(), BACKOFF_MULTIPLIER, JITTER))
                .ignoreExceptions(CallNotPermittedException.class, InterruptedException.class)
                .build();
    }

    public <T> T call(String sourceId, Callable<T> call) throws Exception {
        CircuitBreaker breaker = breaker(sourceId);
        Retry retry = retries.computeIfAbsent(sourceId, id -> Retry.of(id, retryConfig));
        return retry.executeCallable(() -> breaker.executeCallable(call));
    }

    public CircuitBreaker.State state(String sourceId) {
        return breaker(sourceId).getState();
    }

    public Map<String, CircuitBreaker.State> states() {
        Map<String, CircuitBreaker.State> states = new TreeMap<>();
        breakers.forEach((id, breaker) -> states.put(id, breaker.getState()));
        return states;
    }

    private CircuitBreaker breaker(String sourceId) {
        return breakers.computeIfAbsent(sourceId, id -> {
            CircuitBreaker breaker = CircuitBreaker.of(id, breakerConfig);
            breaker.getEventPublisher().onStateTransition(event ->
                    LOGGER.info("Circuit for source " + id + " moved " + event.getStateTransition()));
            return breaker;
        });
    }
}
