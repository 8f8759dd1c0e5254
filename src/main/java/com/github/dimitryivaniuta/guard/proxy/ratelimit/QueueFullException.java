package com.github.dimitryivaniuta.guard.proxy.ratelimit;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardException;
import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

/**
 * Admission backpressure: the wait list is already at capacity. Retryable after a backoff.
 */
@Getter
public class QueueFullException extends UpstreamGuardException {

    private final int maxQueueLength;

    public QueueFullException(int maxQueueLength) {
        super("Request queue is full (" + maxQueueLength + " items). Please try again later.");
        this.maxQueueLength = maxQueueLength;
    }

    @Override
    public HttpStatusCode status() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }

    @Override
    public String clientMessage(boolean production) {
        return "Request queue is full";
    }
}
