package com.github.dimitryivaniuta.guard.proxy.health;

import com.github.dimitryivaniuta.guard.proxy.breaker.CircuitBreakerStatus;
import com.github.dimitryivaniuta.guard.proxy.dedup.DeduplicatingFetcher;
import com.github.dimitryivaniuta.guard.proxy.dedup.FetcherStats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * unhealthy: breaker OPEN; degraded: callers waiting for a slot; healthy: otherwise.
 */
@Service
@RequiredArgsConstructor
public class UpstreamHealthService {

    private final DeduplicatingFetcher fetcher;
    private final Clock clock;

    public UpstreamHealthReport report() {
        FetcherStats stats = fetcher.getStats();
        CircuitBreakerStatus breaker = fetcher.getCircuitBreaker().getStatus();
        return new UpstreamHealthReport(evaluate(stats, breaker), clock.instant(), stats, breaker);
    }

    static UpstreamHealth evaluate(FetcherStats stats, CircuitBreakerStatus breaker) {
        if (breaker.isOpen()) return UpstreamHealth.UNHEALTHY;
        if (stats.queueLength() > 0) return UpstreamHealth.DEGRADED;
        return UpstreamHealth.HEALTHY;
    }
}
