package com.github.dimitryivaniuta.guard.proxy.dedup;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.dimitryivaniuta.guard.proxy.breaker.CircuitBreaker;
import com.github.dimitryivaniuta.guard.proxy.key.CacheKeyBuilder;
import com.github.dimitryivaniuta.guard.proxy.metrics.UpstreamGuardMetrics;
import com.github.dimitryivaniuta.guard.proxy.ratelimit.AdmissionQueue;
import com.github.dimitryivaniuta.guard.proxy.support.Futures;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamClient;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamRequest;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for callers: collapses identical concurrent requests into one upstream call and
 * runs that call through the admission queue and the circuit breaker.
 *
 * <p>Flow per request key:
 * <ol>
 *   <li>an in-flight entry exists: the caller joins it (no admission, no upstream call)</li>
 *   <li>otherwise a new entry is published, a slot is acquired, the call goes through the breaker</li>
 *   <li>on any outcome the slot is released, the entry is evicted and only then the shared future
 *   settles, so the next call with the same key always starts fresh</li>
 * </ol>
 *
 * <p>Nothing is cached past the in-flight window: failures (queue full, breaker open, timeouts)
 * are never replayed to later callers.
 */
@Slf4j
public class DeduplicatingFetcher {

    private final CacheKeyBuilder keyBuilder;
    private final AdmissionQueue admissionQueue;
    private final CircuitBreaker circuitBreaker;
    private final UpstreamClient upstreamClient;
    private final Cache<String, InFlightEntry> inFlight;
    private final Clock clock;
    private final UpstreamGuardMetrics metrics;

    public DeduplicatingFetcher(CacheKeyBuilder keyBuilder,
                                AdmissionQueue admissionQueue,
                                CircuitBreaker circuitBreaker,
                                UpstreamClient upstreamClient,
                                Cache<String, InFlightEntry> inFlight,
                                Clock clock,
                                UpstreamGuardMetrics metrics) {
        this.keyBuilder = Objects.requireNonNull(keyBuilder, "keyBuilder must not be null");
        this.admissionQueue = Objects.requireNonNull(admissionQueue, "admissionQueue must not be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
        this.upstreamClient = Objects.requireNonNull(upstreamClient, "upstreamClient must not be null");
        this.inFlight = Objects.requireNonNull(inFlight, "inFlight must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Each caller gets its own future; cancelling it does not touch the shared upstream call.
     */
    public CompletableFuture<UpstreamResponse> fetch(UpstreamRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String key = keyBuilder.buildKey(request);

        InFlightEntry candidate = new InFlightEntry(key, clock.instant());
        InFlightEntry existing = inFlight.asMap().putIfAbsent(key, candidate);
        if (existing != null) {
            metrics.dedupHit();
            log.debug("Joining in-flight request {} ({})", shortKey(key), request);
            return Futures.detached(existing.shared());
        }

        metrics.dedupMiss();
        CompletableFuture<UpstreamResponse> view = Futures.detached(candidate.shared());
        start(candidate, request);
        return view;
    }

    private void start(InFlightEntry entry, UpstreamRequest request) {
        admissionQueue.acquire().whenComplete((permit, admissionError) -> {
            if (admissionError != null) {
                finish(entry, null, admissionError);
                return;
            }

            CompletableFuture<UpstreamResponse> call;
            try {
                call = circuitBreaker.execute(() -> upstreamClient.exchange(request));
            } catch (RuntimeException ex) {
                call = CompletableFuture.failedFuture(ex);
            }

            call.whenComplete((response, error) -> {
                try {
                    permit.release();
                } finally {
                    finish(entry, response, error);
                }
            });
        });
    }

    private void finish(InFlightEntry entry, UpstreamResponse response, Throwable error) {
        // evict before settling; conditional so a newer entry under the same key survives
        inFlight.asMap().remove(entry.key(), entry);
        if (error != null) {
            log.debug("In-flight request {} failed: {}", shortKey(entry.key()), Futures.unwrap(error).toString());
        }
        Futures.settle(entry.shared(), response, error);
    }

    /**
     * Lock-free snapshot for health checks.
     */
    public FetcherStats getStats() {
        return new FetcherStats(
                admissionQueue.getActiveCount(),
                admissionQueue.getQueueLength(),
                admissionQueue.getMaxConcurrent(),
                inFlight.estimatedSize()
        );
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    private static String shortKey(String key) {
        return key.length() > 12 ? key.substring(0, 12) : key;
    }
}
