package com.github.dimitryivaniuta.guard.proxy.health;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Publishes the guard verdict as the "upstream" actuator health component.
 * DEGRADED maps to UP with a detail so a queue backlog does not fail liveness probes.
 */
@Component("upstream")
@RequiredArgsConstructor
public class UpstreamHealthIndicator implements HealthIndicator {

    private final UpstreamHealthService healthService;

    @Override
    public Health health() {
        UpstreamHealthReport report = healthService.report();
        Status status = report.status() == UpstreamHealth.UNHEALTHY ? Status.DOWN : Status.UP;
        return Health.status(status)
                .withDetail("verdict", report.status().tag())
                .withDetail("breakerState", report.circuitBreaker().state().name())
                .withDetail("activeRequests", report.rateLimiter().activeRequests())
                .withDetail("queueLength", report.rateLimiter().queueLength())
                .build();
    }
}
