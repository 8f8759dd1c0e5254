package com.github.dimitryivaniuta.guard.proxy.ratelimit;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardException;
import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

import java.time.Duration;

@Getter
public class QueueTimeoutException extends UpstreamGuardException {

    private final Duration waited;

    public QueueTimeoutException(Duration waited) {
        super("Request queue timeout: waited " + waited.toMillis() + "ms without getting a slot");
        this.waited = waited;
    }

    @Override
    public HttpStatusCode status() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }

    @Override
    public String clientMessage(boolean production) {
        return "Request queue timed out";
    }
}
