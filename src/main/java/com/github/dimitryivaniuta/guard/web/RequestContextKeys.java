package com.github.dimitryivaniuta.guard.web;


public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    // survives the async re-dispatch of proxied calls
    public static final String CORRELATION_ID_ATTRIBUTE = RequestContextKeys.class.getName() + ".correlationId";
}
