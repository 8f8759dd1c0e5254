package com.github.dimitryivaniuta.guard.proxy.ratelimit;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One admission slot. Releasing it more than once has no effect.
 */
public final class AdmissionPermit implements AutoCloseable {

    private final AdmissionQueue owner;
    private final Instant grantedAt;
    private final AtomicBoolean released = new AtomicBoolean(false);

    AdmissionPermit(AdmissionQueue owner, Instant grantedAt) {
        this.owner = owner;
        this.grantedAt = grantedAt;
    }

    public Instant grantedAt() {
        return grantedAt;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * @return true if this call actually gave the slot back
     */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    public void release() {
        owner.release(this);
    }

    @Override
    public void close() {
        release();
    }
}
