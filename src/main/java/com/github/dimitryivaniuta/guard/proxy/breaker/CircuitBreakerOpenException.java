package com.github.dimitryivaniuta.guard.proxy.breaker;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardException;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

import java.time.Duration;

/**
 * Thrown without touching the upstream while the breaker is OPEN, or while HALF_OPEN has no
 * free probe slot.
 */
@Getter
public class CircuitBreakerOpenException extends UpstreamGuardException {

    private final Duration timeUntilReset;

    public CircuitBreakerOpenException(String message, Duration timeUntilReset) {
        super(message);
        this.timeUntilReset = timeUntilReset;
    }

    @Override
    public HttpStatusCode status() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }

    @Override
    public String clientMessage(boolean production) {
        return "Service unavailable";
    }

    @Override
    public HttpHeaders responseHeaders() {
        HttpHeaders h = new HttpHeaders();
        // seconds, rounded up, never 0 so clients do not spin
        long seconds = Math.max(1, (timeUntilReset.toMillis() + 999) / 1000);
        h.set(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
        return h;
    }
}
