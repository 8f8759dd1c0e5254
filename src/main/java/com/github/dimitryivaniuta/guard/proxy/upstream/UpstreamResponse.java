package com.github.dimitryivaniuta.guard.proxy.upstream;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

public record UpstreamResponse(
        int status,
        HttpHeaders headers,
        String body,
        MediaType contentType
) {
    public UpstreamResponse {
        headers = HttpHeaders.readOnlyHttpHeaders(headers == null ? new HttpHeaders() : headers);
        if (contentType == null) contentType = MediaType.APPLICATION_JSON;
    }
}
