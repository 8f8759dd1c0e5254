package com.github.dimitryivaniuta.guard.proxy.upstream;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardException;
import lombok.Getter;
import org.springframework.http.HttpStatusCode;

/**
 * Breaker-worthy non-2xx answer (5xx and anything else that is not a client error).
 * The body is kept for server-side logs; clients only see it outside production.
 */
@Getter
public class UpstreamHttpException extends UpstreamGuardException {

    private final HttpStatusCode statusCode;
    private final String body;

    public UpstreamHttpException(HttpStatusCode statusCode, String body) {
        super("Upstream error: " + statusCode.value());
        this.statusCode = statusCode;
        this.body = body;
    }

    @Override
    public HttpStatusCode status() {
        return statusCode;
    }

    @Override
    public String clientMessage(boolean production) {
        if (production || body == null || body.isBlank()) {
            return "Upstream error";
        }
        return body;
    }
}
