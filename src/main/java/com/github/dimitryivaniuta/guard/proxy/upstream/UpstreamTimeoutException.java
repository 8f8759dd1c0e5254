package com.github.dimitryivaniuta.guard.proxy.upstream;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

import java.time.Duration;

public class UpstreamTimeoutException extends UpstreamGuardException {

    public UpstreamTimeoutException(Duration timeout, Throwable cause) {
        super("Upstream did not answer within " + timeout.toMillis() + "ms", cause);
    }

    @Override
    public HttpStatusCode status() {
        return HttpStatus.BAD_GATEWAY;
    }

    @Override
    public String clientMessage(boolean production) {
        return "Upstream timed out";
    }
}
