package com.github.dimitryivaniuta.guard.proxy.dedup;

import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamResponse;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * The single shared outcome for one request key while its upstream call is running.
 * Compared by identity so eviction can tell an entry apart from a newer one under the same key.
 */
public final class InFlightEntry {

    private final String key;
    private final CompletableFuture<UpstreamResponse> shared = new CompletableFuture<>();
    private final Instant createdAt;

    InFlightEntry(String key, Instant createdAt) {
        this.key = key;
        this.createdAt = createdAt;
    }

    public String key() {
        return key;
    }

    public Instant createdAt() {
        return createdAt;
    }

    CompletableFuture<UpstreamResponse> shared() {
        return shared;
    }
}
