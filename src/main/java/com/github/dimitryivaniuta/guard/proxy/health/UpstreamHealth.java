package com.github.dimitryivaniuta.guard.proxy.health;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UpstreamHealth {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy");

    private final String tag;
    UpstreamHealth(String tag) { this.tag = tag; }

    @JsonValue
    public String tag() { return tag; }
}
