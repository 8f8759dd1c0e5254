package com.github.dimitryivaniuta.guard.web;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardProperties;
import com.github.dimitryivaniuta.guard.proxy.breaker.CircuitBreakerOpenException;
import com.github.dimitryivaniuta.guard.proxy.ratelimit.QueueFullException;
import com.github.dimitryivaniuta.guard.proxy.ratelimit.QueueTimeoutException;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamFetchException;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamTimeoutException;
import com.github.dimitryivaniuta.guard.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final UpstreamGuardProperties props = new UpstreamGuardProperties();
    private final MutableClock clock = MutableClock.startingAtEpoch();
    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(props, clock);
    private final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/upstream/x");

    @Test
    void queueFull_shouldMapTo503() {
        ResponseEntity<GlobalExceptionHandler.ApiError> res = handler.handleGuard(new QueueFullException(100), request);

        assertThat(res.getStatusCode().value()).isEqualTo(503);
        assertThat(res.getBody().message()).isEqualTo("Request queue is full");
        assertThat(res.getBody().error()).isEqualTo("Service Unavailable");
        assertThat(res.getBody().path()).isEqualTo("/api/upstream/x");
        assertThat(res.getBody().timestamp()).isEqualTo(clock.instant());
    }

    @Test
    void queueTimeout_shouldMapTo503() {
        ResponseEntity<GlobalExceptionHandler.ApiError> res =
                handler.handleGuard(new QueueTimeoutException(Duration.ofSeconds(30)), request);

        assertThat(res.getStatusCode().value()).isEqualTo(503);
        assertThat(res.getBody().message()).isEqualTo("Request queue timed out");
    }

    @Test
    void breakerOpen_shouldCarryRetryAfterRoundedUp() {
        ResponseEntity<GlobalExceptionHandler.ApiError> res = handler.handleGuard(
                new CircuitBreakerOpenException("open", Duration.ofMillis(12_300)), request);

        assertThat(res.getStatusCode().value()).isEqualTo(503);
        assertThat(res.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("13");
        assertThat(res.getBody().message()).isEqualTo("Service unavailable");
    }

    @Test
    void timeoutAndFetchFailures_shouldMapTo502WithDistinctMessages() {
        var timeout = handler.handleGuard(new UpstreamTimeoutException(Duration.ofSeconds(15), null), request);
        var fetch = handler.handleGuard(new UpstreamFetchException(UpstreamFetchException.FETCH_FAILED, null), request);
        var tooLarge = handler.handleGuard(new UpstreamFetchException(UpstreamFetchException.TOO_LARGE, null), request);

        assertThat(timeout.getStatusCode().value()).isEqualTo(502);
        assertThat(timeout.getBody().message()).isEqualTo("Upstream timed out");
        assertThat(fetch.getStatusCode().value()).isEqualTo(502);
        assertThat(fetch.getBody().message()).isEqualTo("Upstream fetch failed");
        assertThat(tooLarge.getBody().message()).isEqualTo("Upstream response too large");
    }

    @Test
    void unexpectedErrors_shouldNotLeakDetails() {
        var res = handler.handleGeneric(new IllegalStateException("secret internals"), request);

        assertThat(res.getStatusCode().value()).isEqualTo(500);
        assertThat(res.getBody().message()).isEqualTo("Unexpected error");
    }
}
