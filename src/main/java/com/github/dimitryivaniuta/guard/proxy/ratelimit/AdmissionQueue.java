package com.github.dimitryivaniuta.guard.proxy.ratelimit;

import com.github.dimitryivaniuta.guard.proxy.metrics.UpstreamGuardMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Bounded-concurrency admission with a bounded FIFO wait list.
 *
 * <ul>
 *   <li>At most {@code maxConcurrent} permits are outstanding at any time.</li>
 *   <li>A new caller takes a slot immediately only if nobody is waiting, so queued callers are
 *   never overtaken.</li>
 *   <li>When {@code maxQueueLength} callers already wait, {@link #acquire()} fails at once with
 *   {@link QueueFullException}.</li>
 *   <li>A waiter still queued after {@code queueTimeout} fails with {@link QueueTimeoutException}
 *   and leaves the list.</li>
 * </ul>
 *
 * <p>State changes happen under the instance monitor; waiter futures are always completed after
 * the monitor is released, so callbacks never run while holding the lock.
 */
@Slf4j
public class AdmissionQueue {

    private final int maxConcurrent;
    private final int maxQueueLength;
    private final Duration queueTimeout;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final UpstreamGuardMetrics metrics;

    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int active;

    // published copies for lock-free stats readers
    private volatile int activeSnapshot;
    private volatile int queuedSnapshot;

    public AdmissionQueue(int maxConcurrent,
                          int maxQueueLength,
                          Duration queueTimeout,
                          ScheduledExecutorService scheduler,
                          Clock clock,
                          UpstreamGuardMetrics metrics) {
        if (maxConcurrent < 1) throw new IllegalArgumentException("maxConcurrent must be >= 1");
        if (maxQueueLength < 0) throw new IllegalArgumentException("maxQueueLength must be >= 0");
        this.maxConcurrent = maxConcurrent;
        this.maxQueueLength = maxQueueLength;
        this.queueTimeout = queueTimeout == null ? Duration.ZERO : queueTimeout;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Requests a slot. The future completes with a permit once the caller is admitted, or fails
     * with {@link QueueFullException} / {@link QueueTimeoutException}. It never fails for any
     * other reason.
     */
    public CompletableFuture<AdmissionPermit> acquire() {
        Waiter waiter;
        synchronized (this) {
            if (waiters.isEmpty() && active < maxConcurrent) {
                active++;
                publish();
                metrics.admissionGranted(false);
                return CompletableFuture.completedFuture(new AdmissionPermit(this, clock.instant()));
            }

            if (waiters.size() >= maxQueueLength) {
                log.warn("Admission queue full ({} waiting, {} active) - rejecting request", waiters.size(), active);
                metrics.admissionRejected("queue_full");
                return CompletableFuture.failedFuture(new QueueFullException(maxQueueLength));
            }

            waiter = new Waiter(clock.instant());
            waiters.addLast(waiter);
            publish();
            log.debug("Queued for admission (position={}, active={})", waiters.size(), active);
        }

        if (!queueTimeout.isZero() && !queueTimeout.isNegative()) {
            waiter.timeoutTask = scheduler.schedule(() -> expire(waiter), queueTimeout.toMillis(), TimeUnit.MILLISECONDS);
            // admitted before the timer was stored: handOff could not cancel it
            if (waiter.future.isDone()) {
                waiter.cancelTimeout();
            }
        }
        return waiter.future;
    }

    /**
     * Gives the slot back and admits the longest-waiting caller, if any.
     */
    public void release(AdmissionPermit permit) {
        Objects.requireNonNull(permit, "permit must not be null");
        if (!permit.markReleased()) return;
        handOff();
    }

    private void handOff() {
        Waiter next;
        synchronized (this) {
            active = Math.max(0, active - 1);
            next = waiters.pollFirst();
            if (next != null) {
                active++;
            }
            publish();
        }
        if (next == null) return;

        AdmissionPermit permit = new AdmissionPermit(this, clock.instant());
        if (next.future.complete(permit)) {
            next.cancelTimeout();
            metrics.admissionGranted(true);
        } else {
            // the waiter expired between poll and complete; pass the slot on
            release(permit);
        }
    }

    private void expire(Waiter waiter) {
        boolean removed;
        synchronized (this) {
            removed = waiters.remove(waiter);
            publish();
        }
        if (!removed) return;

        Duration waited = Duration.between(waiter.enqueuedAt, clock.instant());
        log.warn("Admission wait timed out after {}ms", waited.toMillis());
        metrics.admissionRejected("queue_timeout");
        waiter.future.completeExceptionally(new QueueTimeoutException(queueTimeout));
    }

    private void publish() {
        activeSnapshot = active;
        queuedSnapshot = waiters.size();
    }

    public int getActiveCount() {
        return activeSnapshot;
    }

    public int getQueueLength() {
        return queuedSnapshot;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public int getMaxQueueLength() {
        return maxQueueLength;
    }

    private static final class Waiter {
        final CompletableFuture<AdmissionPermit> future = new CompletableFuture<>();
        final Instant enqueuedAt;
        volatile ScheduledFuture<?> timeoutTask;

        Waiter(Instant enqueuedAt) {
            this.enqueuedAt = enqueuedAt;
        }

        void cancelTimeout() {
            ScheduledFuture<?> task = timeoutTask;
            if (task != null) {
                task.cancel(false);
            }
        }
    }
}
