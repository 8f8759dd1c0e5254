package com.github.dimitryivaniuta.guard.web;

import com.github.dimitryivaniuta.guard.proxy.UpstreamGuardProperties;
import com.github.dimitryivaniuta.guard.proxy.health.UpstreamHealth;
import com.github.dimitryivaniuta.guard.proxy.health.UpstreamHealthReport;
import com.github.dimitryivaniuta.guard.proxy.health.UpstreamHealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/health")
public class UpstreamHealthController {

    private final UpstreamHealthService healthService;
    private final UpstreamGuardProperties props;

    /** Production deployments only learn the verdict; internals stay private. */
    public record HealthSummary(UpstreamHealth status, Instant timestamp) {}

    @GetMapping("/upstream")
    public ResponseEntity<Object> upstream() {
        UpstreamHealthReport report = healthService.report();
        HttpStatus status = report.status() == UpstreamHealth.UNHEALTHY
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        Object body = props.isProduction()
                ? new HealthSummary(report.status(), report.timestamp())
                : report;
        return ResponseEntity.status(status)
                .cacheControl(CacheControl.noStore())
                .body(body);
    }
}
