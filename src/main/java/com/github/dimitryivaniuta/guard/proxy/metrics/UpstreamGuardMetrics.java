package com.github.dimitryivaniuta.guard.proxy.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

@Component
public class UpstreamGuardMetrics {

    private final MeterRegistry registry;

    public UpstreamGuardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Admission ----
    public void admissionGranted(boolean queued) {
        Counter.builder("upstream_guard_admission_granted_total")
                .tag("queued", String.valueOf(queued))
                .register(registry)
                .increment();
    }

    public void admissionRejected(String reason) {
        Counter.builder("upstream_guard_admission_rejected_total")
                .tag("reason", reason) // queue_full | queue_timeout
                .register(registry)
                .increment();
    }

    // ---- Dedup ----
    public void dedupHit() {
        Counter.builder("upstream_guard_dedup_hits_total")
                .register(registry)
                .increment();
    }

    public void dedupMiss() {
        Counter.builder("upstream_guard_dedup_misses_total")
                .register(registry)
                .increment();
    }

    // ---- Circuit breaker ----
    public void breakerTransition(String breaker, String from, String to) {
        Counter.builder("upstream_guard_breaker_transitions_total")
                .tag("breaker", breaker)
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void breakerRejected(String breaker) {
        Counter.builder("upstream_guard_breaker_rejected_total")
                .tag("breaker", breaker)
                .register(registry)
                .increment();
    }

    // ---- Upstream outcome ----
    public void upstreamOutcome(String outcome) {
        Counter.builder("upstream_guard_upstream_calls_total")
                .tag("outcome", outcome) // ok | rate_limited | client_error | http_error | timeout | fetch_error
                .register(registry)
                .increment();
    }

    public void recordUpstreamDuration(long nanos) {
        Timer.builder("upstream_guard_upstream_duration_seconds")
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    // ---- Gauges ----
    public void gauge(String name, Supplier<Number> value) {
        Gauge.builder(name, value)
                .register(registry);
    }
}
