package com.github.dimitryivaniuta.guard.proxy.breaker;

import com.github.dimitryivaniuta.guard.proxy.metrics.UpstreamGuardMetrics;
import com.github.dimitryivaniuta.guard.proxy.support.Futures;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Consecutive-failure circuit breaker guarding one upstream.
 *
 * <p>State machine:
 * <ul>
 *   <li>CLOSED: every call passes. Breaker-worthy failures are counted; a success resets the
 *   count. Reaching {@code failureThreshold} opens the breaker.</li>
 *   <li>OPEN: calls fail fast with {@link CircuitBreakerOpenException} until
 *   {@code resetTimeout} has elapsed since the last failure; the next call moves to HALF_OPEN.</li>
 *   <li>HALF_OPEN: at most {@code halfOpenMaxRequests} probes in flight. Enough successes close
 *   the breaker; any breaker-worthy failure re-opens it and restarts the reset timer.</li>
 * </ul>
 *
 * <p>Which failures are breaker-worthy is decided by the predicate given at construction.
 * All bookkeeping happens under this instance's monitor and never while the wrapped call runs.
 */
@Slf4j
public class CircuitBreaker {

    private static final long NOT_A_PROBE = -1L;

    private final String name;
    private final CircuitBreakerSettings settings;
    private final Predicate<Throwable> recordFailure;
    private final Clock clock;
    private final UpstreamGuardMetrics metrics;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant lastFailureTime;
    private int halfOpenInFlight;
    private int halfOpenSuccesses;
    // bumped on every entry into HALF_OPEN and on reset; late probes of an older round are ignored
    private long halfOpenGeneration;

    public CircuitBreaker(String name,
                          CircuitBreakerSettings settings,
                          Predicate<Throwable> recordFailure,
                          Clock clock,
                          UpstreamGuardMetrics metrics) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.recordFailure = Objects.requireNonNull(recordFailure, "recordFailure must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Default classification: everything except {@link NonBreakerException}.
     */
    public static boolean isBreakerWorthy(Throwable error) {
        return !(Futures.unwrap(error) instanceof NonBreakerException);
    }

    public String getName() {
        return name;
    }

    /**
     * Runs {@code call} if the breaker allows it. The returned future completes with exactly
     * the outcome of the call (unwrapped), or with {@link CircuitBreakerOpenException} when the
     * call was not attempted.
     */
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> call) {
        final long probeGeneration;
        try {
            probeGeneration = acquirePermission();
        } catch (CircuitBreakerOpenException ex) {
            metrics.breakerRejected(name);
            return CompletableFuture.failedFuture(ex);
        }

        CompletionStage<T> stage;
        try {
            stage = Objects.requireNonNull(call.get(), "call returned null");
        } catch (RuntimeException ex) {
            stage = CompletableFuture.failedFuture(ex);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            Throwable cause = (error == null) ? null : Futures.unwrap(error);
            try {
                if (cause == null) {
                    onSuccess(probeGeneration);
                } else if (recordFailure.test(cause)) {
                    onFailure(cause, probeGeneration);
                } else {
                    onIgnoredError(probeGeneration);
                }
            } finally {
                Futures.settle(result, value, cause);
            }
        });
        return result;
    }

    private synchronized long acquirePermission() {
        if (state == CircuitState.OPEN) {
            Duration remaining = remainingOpenTime();
            if (!remaining.isZero()) {
                long seconds = (remaining.toMillis() + 999) / 1000;
                log.error("[Circuit Breaker:{}] OPEN - failing fast (failures={}, retry in {}s)",
                        name, consecutiveFailures, seconds);
                throw new CircuitBreakerOpenException(
                        "Circuit breaker '" + name + "' is open - upstream may be experiencing issues. Retry in " + seconds + "s.",
                        remaining);
            }
            transitionTo(CircuitState.HALF_OPEN);
        }

        if (state == CircuitState.HALF_OPEN) {
            if (halfOpenInFlight >= settings.halfOpenMaxRequests()) {
                log.warn("[Circuit Breaker:{}] HALF_OPEN probe limit reached ({}/{}) - rejecting",
                        name, halfOpenInFlight, settings.halfOpenMaxRequests());
                throw new CircuitBreakerOpenException(
                        "Circuit breaker '" + name + "' is testing recovery - please try again shortly.",
                        Duration.ZERO);
            }
            halfOpenInFlight++;
            return halfOpenGeneration;
        }

        return NOT_A_PROBE;
    }

    private synchronized void onSuccess(long probeGeneration) {
        if (probeGeneration != NOT_A_PROBE) {
            if (state != CircuitState.HALF_OPEN || probeGeneration != halfOpenGeneration) return;
            halfOpenInFlight = Math.max(0, halfOpenInFlight - 1);
            halfOpenSuccesses++;
            log.debug("[Circuit Breaker:{}] probe succeeded ({}/{})",
                    name, halfOpenSuccesses, settings.halfOpenSuccessThreshold());
            if (halfOpenSuccesses >= settings.halfOpenSuccessThreshold()) {
                transitionTo(CircuitState.CLOSED);
            }
            return;
        }

        if (state == CircuitState.CLOSED && consecutiveFailures > 0) {
            log.debug("[Circuit Breaker:{}] resetting failure count (was {})", name, consecutiveFailures);
            consecutiveFailures = 0;
        }
    }

    private synchronized void onFailure(Throwable error, long probeGeneration) {
        if (probeGeneration != NOT_A_PROBE && probeGeneration != halfOpenGeneration) return;
        if (state == CircuitState.HALF_OPEN) {
            if (probeGeneration != halfOpenGeneration) return;
            consecutiveFailures++;
            lastFailureTime = clock.instant();
            log.warn("[Circuit Breaker:{}] probe failed - reopening: {}", name, error.getMessage());
            transitionTo(CircuitState.OPEN);
            return;
        }

        consecutiveFailures++;
        lastFailureTime = clock.instant();

        if (state == CircuitState.CLOSED && consecutiveFailures >= settings.failureThreshold()) {
            log.error("[Circuit Breaker:{}] threshold reached ({}/{}) - opening: {}",
                    name, consecutiveFailures, settings.failureThreshold(), error.getMessage());
            transitionTo(CircuitState.OPEN);
        } else if (state == CircuitState.CLOSED) {
            log.warn("[Circuit Breaker:{}] request failed ({}/{}): {}",
                    name, consecutiveFailures, settings.failureThreshold(), error.getMessage());
        }
    }

    private synchronized void onIgnoredError(long probeGeneration) {
        // neutral outcome: frees the probe slot, counts neither way
        if (state == CircuitState.HALF_OPEN && probeGeneration == halfOpenGeneration) {
            halfOpenInFlight = Math.max(0, halfOpenInFlight - 1);
        }
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        switch (next) {
            case CLOSED -> {
                consecutiveFailures = 0;
                halfOpenInFlight = 0;
                halfOpenSuccesses = 0;
                log.info("[Circuit Breaker:{}] {} -> CLOSED, upstream recovered", name, previous);
            }
            case OPEN -> {
                halfOpenInFlight = 0;
                halfOpenSuccesses = 0;
                log.error("[Circuit Breaker:{}] {} -> OPEN for {}ms", name, previous, settings.resetTimeout().toMillis());
            }
            case HALF_OPEN -> {
                halfOpenGeneration++;
                halfOpenInFlight = 0;
                halfOpenSuccesses = 0;
                log.info("[Circuit Breaker:{}] {} -> HALF_OPEN, allowing {} probe(s)",
                        name, previous, settings.halfOpenMaxRequests());
            }
        }
        metrics.breakerTransition(name, previous.name(), next.name());
    }

    private Duration remainingOpenTime() {
        if (lastFailureTime == null) return Duration.ZERO;
        Duration elapsed = Duration.between(lastFailureTime, clock.instant());
        Duration remaining = settings.resetTimeout().minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Read-only snapshot; never triggers a state transition.
     */
    public synchronized CircuitBreakerStatus getStatus() {
        Duration untilReset = (state == CircuitState.OPEN) ? remainingOpenTime() : Duration.ZERO;
        return new CircuitBreakerStatus(
                name,
                state,
                consecutiveFailures,
                state == CircuitState.OPEN,
                untilReset,
                halfOpenSuccesses,
                lastFailureTime
        );
    }

    /**
     * Forces CLOSED and clears all counters. Probes still in flight are ignored when they land.
     */
    public synchronized void reset() {
        log.info("[Circuit Breaker:{}] manual reset from {}", name, state);
        CircuitState previous = state;
        state = CircuitState.CLOSED;
        consecutiveFailures = 0;
        lastFailureTime = null;
        halfOpenInFlight = 0;
        halfOpenSuccesses = 0;
        halfOpenGeneration++;
        if (previous != CircuitState.CLOSED) {
            metrics.breakerTransition(name, previous.name(), CircuitState.CLOSED.name());
        }
    }
}
