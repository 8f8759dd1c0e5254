package com.github.dimitryivaniuta.guard.proxy;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "upstream-guard")
public class UpstreamGuardProperties {

    /**
     * Base URL of the guarded upstream, e.g. https://api.example.com/v1
     */
    @NotBlank
    private String baseUrl;

    // Conservative on purpose: single process, single egress IP.
    @Min(1)
    @Max(1_000)
    private int maxConcurrent = 3;

    @Min(0)
    @Max(100_000)
    private int maxQueueLength = 100;

    /**
     * Max time a caller waits for an admission slot.
     */
    @NotNull
    private Duration queueTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(15);

    @Min(1)
    private int failureThreshold = 3;

    @NotNull
    private Duration resetTimeout = Duration.ofSeconds(60);

    @Min(1)
    private int halfOpenMaxRequests = 2;

    /**
     * Probe successes needed to close the breaker; 0 means "same as halfOpenMaxRequests".
     */
    @Min(0)
    private int halfOpenSuccessThreshold = 0;

    /**
     * Upper bound on how long an in-flight entry may stay in the dedup map. Must exceed
     * queueTimeout + requestTimeout.
     */
    @NotNull
    private Duration inFlightTtl = Duration.ofSeconds(60);

    // at least maxConcurrent + maxQueueLength
    @Min(1)
    private long maxInFlightEntries = 500;

    @Min(1)
    private int maxResponseBytes = 1_000_000;

    /**
     * Production mode: generic upstream error bodies are hidden from clients and the health
     * endpoint only reports {status, timestamp}.
     */
    private boolean production = false;

    // Rate-limit metadata passed back to the client verbatim (case-insensitive names).
    private List<String> forwardedHeaders = List.of(
            "Retry-After",
            "X-RateLimit-Limit",
            "X-RateLimit-Remaining",
            "X-RateLimit-Reset",
            "RateLimit-Limit",
            "RateLimit-Remaining",
            "RateLimit-Reset"
    );

    /**
     * A waiter must give up before its in-flight entry could expire.
     */
    @AssertTrue(message = "queue-timeout must be positive and in-flight-ttl must exceed queue-timeout + request-timeout")
    public boolean isInFlightTtlSufficient() {
        if (queueTimeout == null || requestTimeout == null || inFlightTtl == null) return true; // @NotNull reports these
        if (queueTimeout.isZero() || queueTimeout.isNegative()) return false;
        return inFlightTtl.compareTo(queueTimeout.plus(requestTimeout)) > 0;
    }

    /**
     * Every admitted or queued call holds one entry; a smaller bound would evict live entries.
     */
    @AssertTrue(message = "max-in-flight-entries must be at least max-concurrent + max-queue-length")
    public boolean isInFlightCapacitySufficient() {
        return maxInFlightEntries >= (long) maxConcurrent + maxQueueLength;
    }

    public int effectiveHalfOpenSuccessThreshold() {
        return halfOpenSuccessThreshold > 0 ? halfOpenSuccessThreshold : halfOpenMaxRequests;
    }
}
