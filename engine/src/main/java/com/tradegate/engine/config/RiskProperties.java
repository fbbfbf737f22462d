package com.tradegate.engine.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "tradegate.risk")
@Data
@Validated
public class RiskProperties {

    private PermissionMatrix permission = new PermissionMatrix();
    private Institutional institutional = new Institutional();
    private Flow flow = new Flow();
    private Clusters clusters = new Clusters();

    @Data
    public static class PermissionMatrix {
        @Positive
        private double baseRisk = 0.0075;

        @Positive
        private double maxDailyR = 2.0;

        @Positive
        private double maxOpenR = 3.0;

        @Min(1)
        private int lossStreakThrottle = 3;

        @Min(1)
        private int lossStreakLock = 4;

        @Min(1)
        private int maxCorrelatedSameCluster = 2;

        @Min(1)
        private int maxTradesPerDayEquity = 8;

        @Min(1)
        private int maxTradesPerDayCrypto = 12;
    }

    /** Caps are expressed in percent of equity. */
    @Data
    public static class Institutional {
        @Positive
        private double maxRiskPerTradePct = 1.0;

        @Positive
        private double maxDailyRiskPct = 3.0;

        @Positive
        private double maxOpenRiskPct = 4.0;

        @Min(1)
        private int maxCorrelated = 2;
    }

    @Data
    public static class Flow {
        @Positive
        private double tpsThreshold = 0.65;

        @Positive
        private double staleDataHealth = 55.0;

        @Positive
        private double blockedSizeCap = 0.35;

        @NotBlank
        private String marketZone = "America/New_York";
    }

    /**
     * Symbol lists per correlation cluster. First match wins, in declaration order.
     */
    @Data
    public static class Clusters {
        private Map<String, List<String>> equity = defaultEquityClusters();
        private Map<String, List<String>> crypto = defaultCryptoClusters();
        private String equityFallback = "GENERAL";
        private String cryptoFallback = "CRYPTO_OTHER";

        private static Map<String, List<String>> defaultEquityClusters() {
            Map<String, List<String>> clusters = new LinkedHashMap<>();
            clusters.put("AI_TECH", List.of("NVDA", "AAPL", "AMD", "MSFT", "META", "GOOGL", "QQQ", "SOXL", "TSLA"));
            clusters.put("GROWTH", List.of("IWM", "ARKK", "SHOP", "SNOW", "NET", "PLTR"));
            clusters.put("ENERGY", List.of("XOM", "CVX", "COP", "XLE"));
            clusters.put("FINANCIALS", List.of("JPM", "BAC", "GS", "MS", "XLF"));
            return clusters;
        }

        private static Map<String, List<String>> defaultCryptoClusters() {
            Map<String, List<String>> clusters = new LinkedHashMap<>();
            clusters.put("CRYPTO_BETA", List.of("BTC", "ETH", "SOL", "AVAX", "RNDR", "FET", "TAO", "NEAR", "APT", "ARB", "OP", "SUI"));
            clusters.put("CRYPTO_AI", List.of("AGIX", "OCEAN", "GRT"));
            clusters.put("CRYPTO_L1", List.of("ADA", "DOT", "ATOM"));
            return clusters;
        }
    }
}
