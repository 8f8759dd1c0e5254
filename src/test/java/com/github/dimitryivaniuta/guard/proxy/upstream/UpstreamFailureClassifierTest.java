package com.github.dimitryivaniuta.guard.proxy.upstream;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardException;
import com.github.dimitryivaniuta.guard.proxy.breaker.CircuitBreaker;
import com.github.dimitryivaniuta.guard.proxy.breaker.NonBreakerException;
import com.github.dimitryivaniuta.guard.support.TestMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpstreamFailureClassifierTest {

    private final UpstreamFailureClassifier classifier = new UpstreamFailureClassifier(
            List.of("Retry-After", "X-RateLimit-Remaining"), Duration.ofSeconds(15), TestMetrics.create());
    private final UpstreamRequest request = UpstreamRequest.get("/v1/me", "t");

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attachAppender() {
        logger = (Logger) LoggerFactory.getLogger(UpstreamFailureClassifier.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    @Test
    void shouldPassSuccessfulResponsesThrough() {
        UpstreamResponse ok = response(204, new HttpHeaders(), "");
        assertThat(classifier.accept(ok, request)).isSameAs(ok);
        assertThat(appender.list).isEmpty();
    }

    @Test
    void rateLimitShouldKeepMessageAndRateLimitHeadersAndLogWarn() {
        HttpHeaders headers = new HttpHeaders();
        headers.set("retry-after", "30");
        headers.set("X-RateLimit-Remaining", "0");
        headers.set("Set-Cookie", "secret=1");

        assertThatThrownBy(() -> classifier.accept(response(429, headers, "Too many requests, slow down"), request))
                .isInstanceOfSatisfying(NonBreakerException.class, ex -> {
                    assertThat(ex.isRateLimited()).isTrue();
                    assertThat(ex.status().value()).isEqualTo(429);
                    assertThat(ex.clientMessage(true)).isEqualTo("Too many requests, slow down");
                    assertThat(ex.responseHeaders().getFirst("Retry-After")).isEqualTo("30");
                    assertThat(ex.responseHeaders().getFirst("X-RateLimit-Remaining")).isEqualTo("0");
                    assertThat(ex.responseHeaders().containsKey("Set-Cookie")).isFalse();
                    assertThat(CircuitBreaker.isBreakerWorthy(ex)).isFalse();
                });

        assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsExactly(Level.WARN);
    }

    @Test
    void clientErrorShouldBeNonBreakerAndSanitizedInProduction() {
        assertThatThrownBy(() -> classifier.accept(response(404, new HttpHeaders(), "no such user 42"), request))
                .isInstanceOfSatisfying(NonBreakerException.class, ex -> {
                    assertThat(ex.status().value()).isEqualTo(404);
                    assertThat(ex.clientMessage(false)).isEqualTo("no such user 42");
                    assertThat(ex.clientMessage(true)).isEqualTo("Upstream request failed");
                    assertThat(CircuitBreaker.isBreakerWorthy(ex)).isFalse();
                });
    }

    @Test
    void serverErrorShouldBeBreakerWorthyAndLoggedAtError() {
        assertThatThrownBy(() -> classifier.accept(response(503, new HttpHeaders(), "db down"), request))
                .isInstanceOfSatisfying(UpstreamHttpException.class, ex -> {
                    assertThat(ex.status().value()).isEqualTo(503);
                    assertThat(ex.clientMessage(true)).isEqualTo("Upstream error");
                    assertThat(ex.clientMessage(false)).isEqualTo("db down");
                    assertThat(CircuitBreaker.isBreakerWorthy(ex)).isTrue();
                });

        assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsExactly(Level.ERROR);
    }

    @Test
    void shouldTranslateTimeoutsSeparatelyFromFetchFailures() {
        assertBadGateway(
                classifier.translate(new CompletionException(new TimeoutException()), request), "Upstream timed out");
        assertBadGateway(
                classifier.translate(new ConnectException("refused"), request), "Upstream fetch failed");
        assertBadGateway(
                classifier.translate(new IllegalStateException("wrapped", new DataBufferLimitException("too big")), request),
                "Upstream response too large");
    }

    @Test
    void alreadyClassifiedFailuresShouldPassThrough() {
        UpstreamHttpException original = new UpstreamHttpException(HttpStatus.BAD_GATEWAY, "x");
        assertThat(classifier.translate(new CompletionException(original), request)).isSameAs(original);
    }

    private static UpstreamResponse response(int status, HttpHeaders headers, String body) {
        return new UpstreamResponse(status, headers, body, null);
    }

    private static void assertBadGateway(UpstreamGuardException ex, String expectedMessage) {
        assertThat(ex.status()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(ex.clientMessage(true)).isEqualTo(expectedMessage);
    }
}
