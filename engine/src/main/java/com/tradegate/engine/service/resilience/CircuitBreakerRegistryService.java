package com.tradegate.engine.service.resilience;

import com.tradegate.engine.config.ResilienceProperties;
import com.tradegate.engine.exception.GatingException;
import com.tradegate.engine.service.GatingMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns one breaker per configured external dependency for the lifetime of the process.
 */
@Service
@Slf4j
public class CircuitBreakerRegistryService {

    private final Map<String, DependencyCircuitBreaker> breakers;

    public CircuitBreakerRegistryService(ResilienceProperties properties,
                                         CircuitBreakerRegistry registry,
                                         GatingMetrics metrics) {
        Map<String, DependencyCircuitBreaker> built = new LinkedHashMap<>();
        properties.getBreakers().forEach((name, cfg) -> {
            built.put(name, new DependencyCircuitBreaker(name, cfg.getFailureThreshold(), cfg.getResetTimeout(), registry, metrics));
            log.info("Registered circuit '{}' (threshold={}, reset={}s)", name, cfg.getFailureThreshold(), cfg.getResetTimeout().toSeconds());
        });
        this.breakers = Collections.unmodifiableMap(built);
    }

    public DependencyCircuitBreaker breaker(String name) {
        DependencyCircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            throw new GatingException("No circuit breaker configured for dependency '" + name + "'");
        }
        return breaker;
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream().map(DependencyCircuitBreaker::snapshot).toList();
    }
}
