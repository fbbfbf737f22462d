package com.tradegate.engine.service.resilience;

import com.tradegate.engine.config.ResilienceProperties;
import com.tradegate.engine.exception.GatingException;
import com.tradegate.engine.service.GatingMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerRegistryServiceTest {

    private final CircuitBreakerRegistryService service = new CircuitBreakerRegistryService(
            new ResilienceProperties(), CircuitBreakerRegistry.ofDefaults(), new GatingMetrics(new SimpleMeterRegistry()));

    @Test
    void registersConfiguredBreakers() {
        assertThat(service.snapshots())
                .extracting(CircuitBreakerSnapshot::name)
                .containsExactly(ResilienceProperties.MARKET_DATA, ResilienceProperties.CRYPTO_DATA, ResilienceProperties.AI_PROVIDER);
        assertThat(service.breaker(ResilienceProperties.CRYPTO_DATA).snapshot().resetTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(service.breaker(ResilienceProperties.AI_PROVIDER).snapshot().failureThreshold()).isEqualTo(3);
    }

    @Test
    void unknownDependencyIsRejected() {
        assertThatThrownBy(() -> service.breaker("broker"))
                .isInstanceOf(GatingException.class)
                .hasMessageContaining("broker");
    }
}
