package com.github.dimitryivaniuta.guard.proxy.health;

import com.github.dimitryivaniuta.guard.proxy.breaker.CircuitBreakerStatus;
import com.github.dimitryivaniuta.guard.proxy.dedup.FetcherStats;

import java.time.Instant;

public record UpstreamHealthReport(
        UpstreamHealth status,
        Instant timestamp,
        FetcherStats rateLimiter,
        CircuitBreakerStatus circuitBreaker
) {}
