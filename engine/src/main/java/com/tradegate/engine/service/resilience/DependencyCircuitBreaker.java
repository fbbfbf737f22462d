package com.tradegate.engine.service.resilience;

import com.tradegate.engine.exception.CircuitOpenException;
import com.tradegate.engine.service.GatingMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Consecutive-failure circuit breaker for one external dependency.
 * <p>
 * CLOSED passes calls through and counts consecutive failures. Reaching the threshold opens the
 * circuit; calls are then rejected with {@link CircuitOpenException} until the reset timeout
 * elapses. The first call after that is the single HALF_OPEN probe: success closes the circuit,
 * failure re-opens it. Concurrent callers during the probe are rejected.
 * <p>
 * State transitions are delegated to the resilience4j state machine, configured so that its
 * count-based window equals the threshold and any window that is entirely failures trips it.
 */
@Slf4j
public class DependencyCircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final Duration resetTimeout;
    private final CircuitBreaker delegate;
    private final GatingMetrics metrics;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<Instant> lastFailureAt = new AtomicReference<>();
    private final AtomicReference<Instant> openedAt = new AtomicReference<>();

    public DependencyCircuitBreaker(String name,
                                    int failureThreshold,
                                    Duration resetTimeout,
                                    CircuitBreakerRegistry registry,
                                    GatingMetrics metrics) {
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.metrics = metrics;
        this.delegate = registry.circuitBreaker(name, consecutiveFailureConfig(failureThreshold, resetTimeout));
        this.delegate.getEventPublisher()
                .onSuccess(event -> consecutiveFailures.set(0))
                .onError(event -> {
                    consecutiveFailures.incrementAndGet();
                    lastFailureAt.set(event.getCreationTime().toInstant());
                })
                .onStateTransition(event -> onTransition(event.getStateTransition()));
    }

    static CircuitBreakerConfig consecutiveFailureConfig(int failureThreshold, Duration resetTimeout) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(resetTimeout)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .writableStackTraceEnabled(false)
                .build();
    }

    public <T> T call(Supplier<T> supplier) {
        try {
            return delegate.executeSupplier(supplier);
        } catch (CallNotPermittedException e) {
            throw rejected();
        }
    }

    public <T> T callChecked(Callable<T> callable) throws Exception {
        try {
            return delegate.executeCallable(callable);
        } catch (CallNotPermittedException e) {
            throw rejected();
        }
    }

    public CircuitState state() {
        return switch (delegate.getState()) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }

    public CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(
                name,
                state(),
                consecutiveFailures.get(),
                lastFailureAt.get(),
                failureThreshold,
                resetTimeout
        );
    }

    public String name() {
        return name;
    }

    private CircuitOpenException rejected() {
        if (metrics != null) {
            metrics.recordCircuitRejection(name);
        }
        Duration retryAfter = retryAfter();
        log.warn("Circuit '{}' is OPEN, rejecting call (retry in {}ms)", name, retryAfter.toMillis());
        return new CircuitOpenException(name, retryAfter);
    }

    private Duration retryAfter() {
        Instant opened = openedAt.get();
        if (opened == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(Instant.now(), opened.plus(resetTimeout));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private void onTransition(CircuitBreaker.StateTransition transition) {
        CircuitBreaker.State to = transition.getToState();
        if (to == CircuitBreaker.State.OPEN) {
            openedAt.set(Instant.now());
        } else if (to == CircuitBreaker.State.CLOSED) {
            consecutiveFailures.set(0);
        }
        log.info("Circuit '{}' transitioned {} -> {}", name, transition.getFromState(), to);
        if (metrics != null) {
            metrics.recordCircuitTransition(name, to.name());
        }
    }
}
