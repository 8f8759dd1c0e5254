package com.github.dimitryivaniuta.guard.proxy.upstream;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardException;
import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardProperties;
import com.github.dimitryivaniuta.guard.proxy.breaker.NonBreakerException;
import com.github.dimitryivaniuta.guard.proxy.metrics.UpstreamGuardMetrics;
import com.github.dimitryivaniuta.guard.proxy.support.Futures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Turns raw upstream outcomes into the guard's error taxonomy.
 *
 * <ul>
 *   <li>2xx: passed through</li>
 *   <li>429: {@link NonBreakerException}, message and rate-limit headers verbatim, logged at WARN</li>
 *   <li>other 4xx: {@link NonBreakerException}, body hidden in production, logged at WARN</li>
 *   <li>5xx and anything else: {@link UpstreamHttpException}, breaker-worthy, logged at ERROR</li>
 *   <li>timeout: {@link UpstreamTimeoutException}; transport errors: {@link UpstreamFetchException}</li>
 * </ul>
 */
@Slf4j
@Component
public class UpstreamFailureClassifier {

    private final Set<String> forwardedHeaderNames;
    private final Duration requestTimeout;
    private final UpstreamGuardMetrics metrics;

    @Autowired
    public UpstreamFailureClassifier(UpstreamGuardProperties props, UpstreamGuardMetrics metrics) {
        this(props.getForwardedHeaders(), props.getRequestTimeout(), metrics);
    }

    public UpstreamFailureClassifier(List<String> forwardedHeaders, Duration requestTimeout, UpstreamGuardMetrics metrics) {
        this.forwardedHeaderNames = forwardedHeaders.stream()
                .map(h -> h.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.requestTimeout = requestTimeout;
        this.metrics = metrics;
    }

    /**
     * @return the response when it is 2xx
     * @throws NonBreakerException   for 4xx (429 included)
     * @throws UpstreamHttpException for every other non-2xx status
     */
    public UpstreamResponse accept(UpstreamResponse response, UpstreamRequest request) {
        HttpStatusCode status = HttpStatusCode.valueOf(response.status());
        if (status.is2xxSuccessful()) {
            metrics.upstreamOutcome("ok");
            return response;
        }

        String body = response.body() == null ? "" : response.body();

        if (status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            HttpHeaders forwarded = forwardedHeaders(response.headers());
            log.warn("Upstream rate limited {} {}: status=429, headers={}", request.method(), request.path(), forwarded);
            metrics.upstreamOutcome("rate_limited");
            String message = body.isBlank() ? HttpStatus.TOO_MANY_REQUESTS.getReasonPhrase() : body;
            throw NonBreakerException.rateLimited(status, forwarded, message);
        }

        if (status.is4xxClientError()) {
            log.warn("Upstream client error {} {}: status={}, body={}", request.method(), request.path(), status.value(), body);
            metrics.upstreamOutcome("client_error");
            throw new NonBreakerException(status, forwardedHeaders(response.headers()), body, false);
        }

        log.error("Upstream error {} {}: status={}, body={}", request.method(), request.path(), status.value(), body);
        metrics.upstreamOutcome("http_error");
        throw new UpstreamHttpException(status, body);
    }

    /**
     * Maps a transport-level failure to a classified exception. Already classified
     * exceptions pass through unchanged.
     */
    public UpstreamGuardException translate(Throwable error, UpstreamRequest request) {
        Throwable cause = Futures.unwrap(error);
        if (cause instanceof UpstreamGuardException classified) {
            return classified;
        }
        if (cause instanceof TimeoutException) {
            log.error("Upstream timed out {} {} after {}ms", request.method(), request.path(), requestTimeout.toMillis());
            metrics.upstreamOutcome("timeout");
            return new UpstreamTimeoutException(requestTimeout, cause);
        }
        if (hasCause(cause, DataBufferLimitException.class)) {
            log.error("Upstream response too large {} {}: {}", request.method(), request.path(), cause.getMessage());
            metrics.upstreamOutcome("fetch_error");
            return new UpstreamFetchException(UpstreamFetchException.TOO_LARGE, cause);
        }
        log.error("Upstream fetch failed {} {}: {}", request.method(), request.path(), cause.toString());
        metrics.upstreamOutcome("fetch_error");
        return new UpstreamFetchException(UpstreamFetchException.FETCH_FAILED, cause);
    }

    public HttpHeaders forwardedHeaders(HttpHeaders source) {
        HttpHeaders out = new HttpHeaders();
        if (source == null) return out;
        source.forEach((name, values) -> {
            if (name != null && forwardedHeaderNames.contains(name.toLowerCase(Locale.ROOT))) {
                out.addAll(name, values);
            }
        });
        return out;
    }

    private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        Throwable cur = t;
        while (cur != null) {
            if (type.isInstance(cur)) return true;
            if (cur.getCause() == cur) break;
            cur = cur.getCause();
        }
        return false;
    }
}
