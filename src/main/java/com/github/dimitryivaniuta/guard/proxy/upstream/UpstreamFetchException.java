package com.github.dimitryivaniuta.guard.proxy.upstream;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

/**
 * Transport-level failure: connection refused, reset, DNS, oversized or unreadable body.
 */
public class UpstreamFetchException extends UpstreamGuardException {

    public static final String FETCH_FAILED = "Upstream fetch failed";
    public static final String TOO_LARGE = "Upstream response too large";

    private final String clientMessage;

    public UpstreamFetchException(String clientMessage, Throwable cause) {
        super(clientMessage + ": " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.clientMessage = clientMessage;
    }

    @Override
    public HttpStatusCode status() {
        return HttpStatus.BAD_GATEWAY;
    }

    @Override
    public String clientMessage(boolean production) {
        return clientMessage;
    }
}
