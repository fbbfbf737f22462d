package com.tradegate.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "tradegate.resilience")
@Data
@Validated
public class ResilienceProperties {

    public static final String MARKET_DATA = "market-data";
    public static final String CRYPTO_DATA = "crypto-data";
    public static final String AI_PROVIDER = "ai-provider";

    @Valid
    private Map<String, Breaker> breakers = defaults();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Breaker {
        @Min(1)
        private int failureThreshold = 5;

        @NotNull
        private Duration resetTimeout = Duration.ofSeconds(60);
    }

    private static Map<String, Breaker> defaults() {
        Map<String, Breaker> breakers = new LinkedHashMap<>();
        breakers.put(MARKET_DATA, new Breaker(5, Duration.ofSeconds(60)));
        breakers.put(CRYPTO_DATA, new Breaker(5, Duration.ofSeconds(45)));
        breakers.put(AI_PROVIDER, new Breaker(3, Duration.ofSeconds(30)));
        return breakers;
    }
}
