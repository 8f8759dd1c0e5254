package com.github.dimitryivaniuta.guard.proxy.breaker;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
