package com.github.dimitryivaniuta.guard.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts the caller's correlation id (or a fresh one) into the MDC and echoes it back.
 * Runs on async dispatches too, so errors of proxied calls are logged and reported with the same id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String corr = (String) request.getAttribute(RequestContextKeys.CORRELATION_ID_ATTRIBUTE);
        if (corr == null) {
            corr = request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER);
            if (corr == null || corr.isBlank()) corr = UUID.randomUUID().toString();
            request.setAttribute(RequestContextKeys.CORRELATION_ID_ATTRIBUTE, corr);
            response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, corr);
        }

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, corr);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        }
    }
}
