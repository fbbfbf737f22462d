package com.tradegate.engine.service.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
