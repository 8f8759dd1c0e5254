package com.github.dimitryivaniuta.guard.proxy.breaker;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a breaker, for health checks and dashboards.
 *
 * @param lastFailureTime null when no breaker-worthy failure was recorded yet
 */
public record CircuitBreakerStatus(
        String name,
        CircuitState state,
        int failures,
        boolean isOpen,
        Duration timeUntilReset,
        int successCount,
        Instant lastFailureTime
) {}
