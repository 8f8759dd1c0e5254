package com.github.dimitryivaniuta.guard.proxy.breaker;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;

/**
 * A non-2xx outcome that is propagated to the client but never counted against the breaker:
 * upstream rate limiting (429) or a client error that says nothing about upstream health.
 */
public class NonBreakerException extends UpstreamGuardException {

    private final HttpStatusCode status;
    private final HttpHeaders headers;
    private final String upstreamMessage;
    private final boolean safeToExpose;

    public NonBreakerException(HttpStatusCode status,
                               HttpHeaders headers,
                               String upstreamMessage,
                               boolean safeToExpose) {
        super("Upstream responded " + status.value() + ": " + upstreamMessage);
        this.status = status;
        this.headers = HttpHeaders.readOnlyHttpHeaders(headers == null ? new HttpHeaders() : headers);
        this.upstreamMessage = upstreamMessage;
        this.safeToExpose = safeToExpose;
    }

    public static NonBreakerException rateLimited(HttpStatusCode status, HttpHeaders forwarded, String body) {
        return new NonBreakerException(status, forwarded, body, true);
    }

    public boolean isRateLimited() {
        return status.value() == 429;
    }

    public String upstreamMessage() {
        return upstreamMessage;
    }

    @Override
    public HttpStatusCode status() {
        return status;
    }

    @Override
    public String clientMessage(boolean production) {
        if (safeToExpose || !production) {
            return upstreamMessage;
        }
        return "Upstream request failed";
    }

    @Override
    public HttpHeaders responseHeaders() {
        return headers;
    }
}
