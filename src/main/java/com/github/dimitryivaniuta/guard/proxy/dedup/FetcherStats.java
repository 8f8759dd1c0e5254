package com.github.dimitryivaniuta.guard.proxy.dedup;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FetcherStats(
        int activeRequests,
        int queueLength,
        int maxConcurrent,
        long cacheSize
) {
    @JsonProperty("utilizationPercent")
    public int utilizationPercent() {
        if (maxConcurrent <= 0) return 0;
        return Math.round(activeRequests * 100f / maxConcurrent);
    }
}
