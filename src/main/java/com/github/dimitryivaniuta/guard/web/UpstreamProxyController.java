package com.github.dimitryivaniuta.guard.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.guard.proxy.dedup.DeduplicatingFetcher;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamFailureClassifier;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamRequest;
import com.github.dimitryivaniuta.guard.proxy.upstream.UpstreamResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;

/**
 * Pass-through surface: {@code /api/upstream/<path>?<query>} is fetched from the upstream as
 * {@code <baseUrl>/<path>?<query>} through the guard.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping(UpstreamProxyController.PREFIX)
public class UpstreamProxyController {

    static final String PREFIX = "/api/upstream";
    private static final String BEARER = "Bearer ";

    private final DeduplicatingFetcher fetcher;
    private final UpstreamFailureClassifier classifier;

    @RequestMapping(value = "/**", method = {
            RequestMethod.GET, RequestMethod.POST, RequestMethod.PUT, RequestMethod.PATCH, RequestMethod.DELETE
    })
    public CompletableFuture<ResponseEntity<String>> proxy(
            HttpServletRequest request,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) JsonNode body) {

        UpstreamRequest upstreamRequest = new UpstreamRequest(
                HttpMethod.valueOf(request.getMethod()),
                upstreamPath(request),
                bearerToken(authorization),
                body
        );
        return fetcher.fetch(upstreamRequest).thenApply(this::toResponse);
    }

    private ResponseEntity<String> toResponse(UpstreamResponse response) {
        return ResponseEntity.status(response.status())
                .headers(classifier.forwardedHeaders(response.headers()))
                .contentType(response.contentType())
                .body(response.body());
    }

    static String upstreamPath(HttpServletRequest request) {
        String uri = request.getRequestURI().substring(request.getContextPath().length());
        String path = uri.length() > PREFIX.length() ? uri.substring(PREFIX.length()) : "";
        String query = request.getQueryString();
        return (query == null || query.isEmpty()) ? path : path + "?" + query;
    }

    static String bearerToken(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return null;
        }
        String token = authorization.substring(BEARER.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
