package com.github.dimitryivaniuta.guard.proxy.breaker;

import java.time.Duration;
import java.util.Objects;

public record CircuitBreakerSettings(
        int failureThreshold,
        Duration resetTimeout,
        int halfOpenMaxRequests,
        int halfOpenSuccessThreshold
) {
    public CircuitBreakerSettings {
        Objects.requireNonNull(resetTimeout, "resetTimeout must not be null");
        if (failureThreshold < 1) throw new IllegalArgumentException("failureThreshold must be >= 1");
        if (halfOpenMaxRequests < 1) throw new IllegalArgumentException("halfOpenMaxRequests must be >= 1");
        if (halfOpenSuccessThreshold < 1) throw new IllegalArgumentException("halfOpenSuccessThreshold must be >= 1");
        if (resetTimeout.isNegative()) throw new IllegalArgumentException("resetTimeout must not be negative");
    }

    public static CircuitBreakerSettings defaults() {
        return new CircuitBreakerSettings(3, Duration.ofSeconds(60), 2, 2);
    }
}
