package com.github.dimitryivaniuta.guard.proxy.upstream;

import java.util.concurrent.CompletableFuture;

/**
 * One HTTP exchange with the guarded upstream.
 *
 * <p>Implementations complete with a 2xx {@link UpstreamResponse} or fail with one of the
 * classified exceptions: {@link UpstreamTimeoutException}, {@link UpstreamFetchException},
 * {@link UpstreamHttpException} or
 * {@link com.github.dimitryivaniuta.guard.proxy.breaker.NonBreakerException}.
 */
public interface UpstreamClient {

    CompletableFuture<UpstreamResponse> exchange(UpstreamRequest request);
}
