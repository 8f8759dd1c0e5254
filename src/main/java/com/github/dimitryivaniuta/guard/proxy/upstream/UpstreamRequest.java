package com.github.dimitryivaniuta.guard.proxy.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;

import java.util.Objects;

/**
 * What a caller asks the upstream for.
 *
 * @param method      HTTP method
 * @param path        upstream path, optionally with query string; leading slashes are ignored
 * @param callerToken opaque credential forwarded as a bearer token; null for anonymous calls
 * @param body        optional JSON payload
 */
public record UpstreamRequest(
        HttpMethod method,
        String path,
        String callerToken,
        JsonNode body
) {
    public UpstreamRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }

    public static UpstreamRequest get(String path, String callerToken) {
        return new UpstreamRequest(HttpMethod.GET, path, callerToken, null);
    }

    public boolean hasBody() {
        return body != null && !body.isMissingNode();
    }

    @Override
    public String toString() {
        // never print the token
        return "UpstreamRequest[" + method + " " + path + ", body=" + hasBody() + "]";
    }
}
