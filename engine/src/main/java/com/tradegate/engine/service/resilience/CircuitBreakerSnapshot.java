package com.tradegate.engine.service.resilience;

import java.time.Duration;
import java.time.Instant;

public record CircuitBreakerSnapshot(
        String name,
        CircuitState state,
        int consecutiveFailures,
        Instant lastFailureAt,
        int failureThreshold,
        Duration resetTimeout
) {
}
