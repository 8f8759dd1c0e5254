package com.github.dimitryivaniuta.guard.web;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardException;
import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardProperties;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Clock;
import java.time.Instant;

import static com.github.dimitryivaniuta.guard.web.RequestContextKeys.CORRELATION_ID_MDC_KEY;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final UpstreamGuardProperties props;
    private final Clock clock;

    public record ApiError(
            Instant timestamp,
            int status,
            String error,
            String message,
            String path,
            String correlationId
    ) {}

    /**
     * Every classified guard failure: status, client-safe message and forwarded headers come
     * from the exception. Severity was already logged where the failure was classified.
     */
    @ExceptionHandler(UpstreamGuardException.class)
    public ResponseEntity<ApiError> handleGuard(UpstreamGuardException ex, HttpServletRequest req) {
        log.debug("Guard failure on {}: {}", req.getRequestURI(), ex.getMessage());
        HttpHeaders h = new HttpHeaders();
        h.putAll(ex.responseHeaders());
        ApiError body = error(ex.status(), ex.clientMessage(props.isProduction()), req);
        return new ResponseEntity<>(body, h, ex.status());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(HttpStatus.BAD_REQUEST, "Malformed JSON body", req));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiError> handleMediaType(HttpMediaTypeNotSupportedException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Only JSON bodies are accepted", req));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleMethod(HttpRequestMethodNotSupportedException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(error(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage(), req));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> noResource(NoResourceFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(error(HttpStatus.NOT_FOUND, ex.getMessage(), req));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", req));
    }

    private ApiError error(HttpStatusCode status, String message, HttpServletRequest req) {
        HttpStatus known = HttpStatus.resolve(status.value());
        String reason = known != null ? known.getReasonPhrase() : "HTTP " + status.value();
        return new ApiError(
                clock.instant(),
                status.value(),
                reason,
                (message == null || message.isBlank()) ? reason : message,
                req.getRequestURI(),
                MDC.get(CORRELATION_ID_MDC_KEY)
        );
    }
}
