package com.tradegate.engine.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Raised when a call is rejected because the dependency's circuit is open.
 */
@Getter
public class CircuitOpenException extends GatingException {

    private final String dependency;
    private final Duration retryAfter;

    public CircuitOpenException(String dependency, Duration retryAfter) {
        super("Circuit '" + dependency + "' is OPEN; retry after " + retryAfter.toMillis() + "ms");
        this.dependency = dependency;
        this.retryAfter = retryAfter;
    }
}
