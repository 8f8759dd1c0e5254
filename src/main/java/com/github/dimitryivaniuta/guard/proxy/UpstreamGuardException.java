package com.github.dimitryivaniuta.guard.proxy;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;

/**
 * Root of every classified failure surfaced by the guard.
 *
 * <p>Each subtype knows the HTTP status it maps to and the message a client is allowed to
 * see. The exception message itself may carry more detail and is meant for server logs.
 */
public abstract class UpstreamGuardException extends RuntimeException {

    protected UpstreamGuardException(String message) {
        super(message);
    }

    protected UpstreamGuardException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatusCode status();

    /**
     * Message safe to return to the client.
     *
     * @param production whether upstream details must be hidden
     */
    public abstract String clientMessage(boolean production);

    /**
     * Headers to add to the client response (e.g. Retry-After, rate-limit metadata).
     */
    public HttpHeaders responseHeaders() {
        return HttpHeaders.EMPTY;
    }
}
