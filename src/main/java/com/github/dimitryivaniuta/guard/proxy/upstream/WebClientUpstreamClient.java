package com.github.dimitryivaniuta.guard.proxy.upstream;

import com.github.dimitryivaniuta.guard.proxy.breaker.NonBreakerException;
import com.github.dimitryivaniuta.guard.proxy.key.CacheKeyBuilder;
import com.github.dimitryivaniuta.guard.proxy.metrics.UpstreamGuardMetrics;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Calls the upstream with {@link WebClient}.
 *
 * <p>The exchange is bounded by a resilience4j {@link TimeLimiter}: when it fires, the pending
 * future fails with a {@link java.util.concurrent.TimeoutException} and the HTTP subscription is
 * disposed, which cancels the exchange. Callers can never cancel it.
 */
@Slf4j
public class WebClientUpstreamClient implements UpstreamClient {

    private final WebClient webClient;
    private final String baseUrl;
    private final TimeLimiter timeLimiter;
    private final ScheduledExecutorService scheduler;
    private final UpstreamFailureClassifier classifier;
    private final UpstreamGuardMetrics metrics;

    public WebClientUpstreamClient(WebClient webClient,
                                   String baseUrl,
                                   TimeLimiter timeLimiter,
                                   ScheduledExecutorService scheduler,
                                   UpstreamFailureClassifier classifier,
                                   UpstreamGuardMetrics metrics) {
        this.webClient = webClient;
        this.baseUrl = stripTrailingSlashes(baseUrl);
        this.timeLimiter = timeLimiter;
        this.scheduler = scheduler;
        this.classifier = classifier;
        this.metrics = metrics;
    }

    @Override
    public CompletableFuture<UpstreamResponse> exchange(UpstreamRequest request) {
        URI target;
        try {
            target = URI.create(baseUrl + "/" + CacheKeyBuilder.normalizePath(request.path()));
        } catch (IllegalArgumentException ex) {
            // caller mistake, not an upstream health signal
            return CompletableFuture.failedFuture(
                    new NonBreakerException(HttpStatus.BAD_REQUEST, null, "Invalid upstream path", true));
        }

        long start = System.nanoTime();
        log.debug("Upstream call {} {}", request.method(), target.getPath());

        CompletableFuture<UpstreamResponse> pending = new CompletableFuture<>();
        Disposable subscription = send(request, target).subscribe(
                pending::complete,
                pending::completeExceptionally,
                () -> pending.completeExceptionally(new IllegalStateException("Upstream returned no response")));
        // a timeout completes `pending` exceptionally; dropping the subscription cancels the exchange
        pending.whenComplete((r, e) -> {
            if (e != null) subscription.dispose();
        });

        CompletableFuture<UpstreamResponse> result = new CompletableFuture<>();
        timeLimiter.executeCompletionStage(scheduler, () -> pending)
                .whenComplete((raw, error) -> {
                    metrics.recordUpstreamDuration(System.nanoTime() - start);
                    try {
                        if (error != null) {
                            result.completeExceptionally(classifier.translate(error, request));
                        } else {
                            result.complete(classifier.accept(raw, request));
                        }
                    } catch (RuntimeException ex) {
                        result.completeExceptionally(ex);
                    }
                });
        return result;
    }

    private Mono<UpstreamResponse> send(UpstreamRequest request, URI target) {
        WebClient.RequestBodySpec spec = webClient
                .method(request.method())
                .uri(target)
                .headers(h -> applyHeaders(h, request));

        WebClient.RequestHeadersSpec<?> ready = request.hasBody() ? spec.bodyValue(request.body()) : spec;

        return ready.exchangeToMono(response -> response.toEntity(String.class)
                .map(entity -> new UpstreamResponse(
                        entity.getStatusCode().value(),
                        copyOf(entity.getHeaders()),
                        entity.getBody(),
                        entity.getHeaders().getContentType()
                )));
    }

    private static void applyHeaders(HttpHeaders h, UpstreamRequest request) {
        if (request.callerToken() != null && !request.callerToken().isBlank()) {
            h.setBearerAuth(request.callerToken());
        }
        h.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (request.hasBody()) {
            h.setContentType(MediaType.APPLICATION_JSON);
        }
    }

    private static HttpHeaders copyOf(HttpHeaders source) {
        HttpHeaders copy = new HttpHeaders();
        copy.putAll(source);
        return copy;
    }

    private static String stripTrailingSlashes(String url) {
        if (url == null) throw new IllegalArgumentException("baseUrl must not be null");
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') end--;
        return url.substring(0, end);
    }
}
