package com.github.dimitryivaniuta.guard.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardProperties;
import com.github.dimitryivaniuta.guard.proxy.breaker.CircuitBreaker;
import com.github.dimitryivaniuta.guard.proxy.breaker.CircuitBreakerSettings;
import com.github.dimitryivaniuta.guard.proxy.dedup.DeduplicatingFetcher;
import com.github.dimitryivaniuta.guard.proxy.dedup.InFlightEntry;
import com.github.dimitryivaniuta.guard.proxy.key.CacheKeyBuilder;
import com.github.dimitryivaniuta.guard.proxy.metrics.UpstreamGuardMetrics;
import com.github.dimitryivaniuta.guard.proxy.ratelimit.AdmissionQueue;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires one guard (queue + breaker + fetcher) for the configured upstream.
 * A second upstream would get its own set of these beans.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(UpstreamGuardProperties.class)
public class UpstreamGuardConfig {

    @Bean
    public CircuitBreaker upstreamCircuitBreaker(UpstreamGuardProperties props, Clock clock, UpstreamGuardMetrics metrics) {
        CircuitBreakerSettings settings = new CircuitBreakerSettings(
                props.getFailureThreshold(),
                props.getResetTimeout(),
                props.getHalfOpenMaxRequests(),
                props.effectiveHalfOpenSuccessThreshold()
        );
        log.info("Circuit breaker: failureThreshold={}, resetTimeout={}ms, halfOpenMaxRequests={}, halfOpenSuccessThreshold={}",
                settings.failureThreshold(), settings.resetTimeout().toMillis(),
                settings.halfOpenMaxRequests(), settings.halfOpenSuccessThreshold());
        return new CircuitBreaker("upstream", settings, CircuitBreaker::isBreakerWorthy, clock, metrics);
    }

    @Bean
    public AdmissionQueue upstreamAdmissionQueue(UpstreamGuardProperties props,
                                                 ScheduledExecutorService guardScheduler,
                                                 Clock clock,
                                                 UpstreamGuardMetrics metrics) {
        log.info("Admission queue: maxConcurrent={}, maxQueueLength={}, queueTimeout={}ms",
                props.getMaxConcurrent(), props.getMaxQueueLength(), props.getQueueTimeout().toMillis());
        return new AdmissionQueue(props.getMaxConcurrent(), props.getMaxQueueLength(), props.getQueueTimeout(),
                guardScheduler, clock, metrics);
    }

    @Bean
    public DeduplicatingFetcher deduplicatingFetcher(CacheKeyBuilder keyBuilder,
                                                     AdmissionQueue upstreamAdmissionQueue,
                                                     CircuitBreaker upstreamCircuitBreaker,
                                                     UpstreamClient upstreamClient,
                                                     Cache<String, InFlightEntry> inFlightRequests,
                                                     Clock clock,
                                                     UpstreamGuardMetrics metrics) {
        DeduplicatingFetcher fetcher = new DeduplicatingFetcher(keyBuilder, upstreamAdmissionQueue,
                upstreamCircuitBreaker, upstreamClient, inFlightRequests, clock, metrics);

        metrics.gauge("upstream_guard_active_requests", () -> fetcher.getStats().activeRequests());
        metrics.gauge("upstream_guard_queue_length", () -> fetcher.getStats().queueLength());
        metrics.gauge("upstream_guard_inflight_entries", () -> fetcher.getStats().cacheSize());
        return fetcher;
    }
}
