package com.tradegate.engine.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "tradegate.execution")
@Data
@Validated
public class ExecutionProperties {

    @Positive
    private double defaultEquity = 100_000.0;

    @Positive
    @DecimalMax("0.10")
    private double defaultRiskPct = 0.0075;

    @Positive
    private double maxNotionalPct = 0.25;

    @Positive
    private double kellyDamper = 0.25;

    private Limits limits = new Limits();
    private Atr atr = new Atr();

    /**
     * Hard limits enforced by the execution-layer governor regardless of the upstream verdict.
     */
    @Data
    public static class Limits {
        @Positive
        private double maxDailyLossPct = 0.02;

        @Positive
        private double maxPortfolioHeatPct = 0.06;

        @Positive
        private double minRewardRisk = 1.5;

        @Min(1)
        private int maxOpenTrades = 8;

        @Positive
        private double maxSingleTradeRiskPct = 0.02;

        @Positive
        private double highNotionalPct = 0.5;
    }

    @Data
    public static class Atr {
        @Min(2)
        private int period = 14;

        private Duration cacheTtl = Duration.ofMinutes(5);
    }
}
