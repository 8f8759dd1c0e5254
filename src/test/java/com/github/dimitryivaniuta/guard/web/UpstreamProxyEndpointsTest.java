package com.github.dimitryivaniuta.guard.web;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardProperties;
import com.github.dimitryivaniuta.guard.proxy.breaker.CircuitBreaker;
import com.github.dimitryivaniuta.guard.proxy.breaker.NonBreakerException;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamClient;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamFetchException;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamHttpException;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamRequest;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamResponse;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class UpstreamProxyEndpointsTest {

    @Autowired MockMvc mvc;
    @Autowired CircuitBreaker breaker;
    @Autowired UpstreamGuardProperties props;

    @MockBean UpstreamClient upstreamClient;

    @BeforeEach
    void resetGuard() {
        breaker.reset();
        props.setProduction(false);
    }

    @AfterEach
    void restoreMode() {
        props.setProduction(false);
    }

    @Test
    void get_shouldForwardPathQueryAndTokenAndReturnUpstreamAnswer() throws Exception {
        HttpHeaders upstreamHeaders = new HttpHeaders();
        upstreamHeaders.set("X-RateLimit-Remaining", "41");
        upstreamHeaders.set("Set-Cookie", "upstream-session=1");
        when(upstreamClient.exchange(any())).thenReturn(CompletableFuture.completedFuture(
                new UpstreamResponse(200, upstreamHeaders, "{\"id\":\"me\"}", MediaType.APPLICATION_JSON)));

        perform(get("/api/upstream/v1/users/me").queryParam("fields", "id")
                .header(HttpHeaders.AUTHORIZATION, "Bearer abc123"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().json("{\"id\":\"me\"}"))
                .andExpect(header().string("X-RateLimit-Remaining", "41"))
                .andExpect(header().doesNotExist("Set-Cookie"));

        ArgumentCaptor<UpstreamRequest> captor = ArgumentCaptor.forClass(UpstreamRequest.class);
        verify(upstreamClient).exchange(captor.capture());
        UpstreamRequest sent = captor.getValue();
        assertThat(sent.method()).isEqualTo(HttpMethod.GET);
        assertThat(sent.path()).isEqualTo("/v1/users/me?fields=id");
        assertThat(sent.callerToken()).isEqualTo("abc123");
        assertThat(sent.hasBody()).isFalse();
    }

    @Test
    void post_shouldForwardJsonBody() throws Exception {
        when(upstreamClient.exchange(any())).thenReturn(CompletableFuture.completedFuture(
                new UpstreamResponse(201, new HttpHeaders(), "{\"ok\":true}", MediaType.APPLICATION_JSON)));

        perform(post("/api/upstream/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"sku":"A-1","qty":2}
                        """))
                .andExpect(status().isCreated());

        ArgumentCaptor<UpstreamRequest> captor = ArgumentCaptor.forClass(UpstreamRequest.class);
        verify(upstreamClient).exchange(captor.capture());
        assertThat(captor.getValue().body().get("qty").asInt()).isEqualTo(2);
        assertThat(captor.getValue().callerToken()).isNull();
    }

    @Test
    void upstream429_shouldBePassedThroughWithRateLimitHeaders() throws Exception {
        HttpHeaders forwarded = new HttpHeaders();
        forwarded.set("Retry-After", "30");
        when(upstreamClient.exchange(any())).thenReturn(CompletableFuture.failedFuture(
                NonBreakerException.rateLimited(HttpStatus.TOO_MANY_REQUESTS, forwarded, "Too many requests for this token")));

        props.setProduction(true);
        perform(get("/api/upstream/v1/me").header(RequestContextKeys.CORRELATION_ID_HEADER, "corr-429"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "30"))
                .andExpect(jsonPath("$.status").value(429))
                .andExpect(jsonPath("$.message").value("Too many requests for this token"))
                .andExpect(jsonPath("$.path").value("/api/upstream/v1/me"))
                .andExpect(jsonPath("$.correlationId").value("corr-429"));
    }

    @Test
    void upstream5xx_shouldBeSanitizedOnlyInProduction() throws Exception {
        when(upstreamClient.exchange(any())).thenReturn(CompletableFuture.failedFuture(
                new UpstreamHttpException(HttpStatus.INTERNAL_SERVER_ERROR, "NullPointerException at Foo.java:42")));

        perform(get("/api/upstream/dev"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("NullPointerException at Foo.java:42"));

        props.setProduction(true);
        perform(get("/api/upstream/prod"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Upstream error"));
    }

    @Test
    void upstreamClientError_shouldKeepStatusAndHideBodyInProduction() throws Exception {
        when(upstreamClient.exchange(any())).thenReturn(CompletableFuture.failedFuture(
                new NonBreakerException(HttpStatus.NOT_FOUND, null, "user 42 not found in shard eu-1", false)));

        props.setProduction(true);
        perform(get("/api/upstream/users/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Upstream request failed"));
    }

    @Test
    void repeatedFailures_shouldOpenBreakerAndFailFastWithRetryAfter() throws Exception {
        when(upstreamClient.exchange(any())).thenReturn(CompletableFuture.failedFuture(
                new UpstreamTimeoutException(Duration.ofSeconds(2), null)));

        for (int i = 0; i < 3; i++) {
            perform(get("/api/upstream/slow/" + i))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.message").value("Upstream timed out"));
        }

        perform(get("/api/upstream/slow/next"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.message").value("Service unavailable"));

        verify(upstreamClient, times(3)).exchange(any());
    }

    @Test
    void fetchFailure_shouldMapToBadGateway() throws Exception {
        when(upstreamClient.exchange(any())).thenReturn(CompletableFuture.failedFuture(
                new UpstreamFetchException(UpstreamFetchException.FETCH_FAILED, new IllegalStateException("reset"))));

        perform(get("/api/upstream/x"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("Upstream fetch failed"))
                .andExpect(jsonPath("$.error").value("Bad Gateway"));
    }

    @Test
    void health_shouldReportFullDetailsInDevelopment() throws Exception {
        mvc.perform(get("/api/health/upstream"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CACHE_CONTROL, "no-store"))
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.timestamp").exists())
                .andExpect(jsonPath("$.rateLimiter.maxConcurrent").value(3))
                .andExpect(jsonPath("$.rateLimiter.utilizationPercent").value(0))
                .andExpect(jsonPath("$.circuitBreaker.state").value("CLOSED"))
                .andExpect(jsonPath("$.circuitBreaker.lastFailureTime").value(nullValue()));
    }

    @Test
    void health_shouldBeUnavailableAndMinimalWhenBreakerOpenInProduction() throws Exception {
        when(upstreamClient.exchange(any())).thenReturn(CompletableFuture.failedFuture(
                new UpstreamHttpException(HttpStatus.SERVICE_UNAVAILABLE, "down")));
        for (int i = 0; i < 3; i++) {
            perform(get("/api/upstream/down/" + i)).andExpect(status().isServiceUnavailable());
        }

        props.setProduction(true);
        mvc.perform(get("/api/health/upstream"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string(HttpHeaders.CACHE_CONTROL, "no-store"))
                .andExpect(jsonPath("$.status").value("unhealthy"))
                .andExpect(jsonPath("$.timestamp").exists())
                .andExpect(jsonPath("$.rateLimiter").doesNotExist())
                .andExpect(jsonPath("$.circuitBreaker").doesNotExist());
    }

    private ResultActions perform(MockHttpServletRequestBuilder builder) throws Exception {
        MvcResult started = mvc.perform(builder)
                .andExpect(request().asyncStarted())
                .andReturn();
        return mvc.perform(asyncDispatch(started));
    }
}
