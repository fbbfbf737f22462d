package com.tradegate.engine.config;

import com.tradegate.engine.model.OpenPosition;
import com.tradegate.engine.trading.marketdata.CandleSource;
import com.tradegate.engine.trading.pipeline.AccountDataProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Optional;

/**
 * Fallback collaborators used until a market-data vendor and trade journal are wired in.
 * Without candles every pipeline run stops at NO_ATR unless the caller supplies an ATR.
 */
@Configuration
@Slf4j
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean
    public CandleSource candleSource() {
        log.warn("No CandleSource configured; ATR must be supplied by callers");
        return (symbol, assetClass, bars) -> List.of();
    }

    @Bean
    @ConditionalOnMissingBean
    public AccountDataProvider accountDataProvider() {
        log.warn("No AccountDataProvider configured; using default equity and a flat book");
        return new AccountDataProvider() {
            @Override
            public Optional<Double> latestEquity(String accountId) {
                return Optional.empty();
            }

            @Override
            public List<OpenPosition> openPositions(String accountId) {
                return List.of();
            }

            @Override
            public double dailyRealizedPnl(String accountId) {
                return 0.0;
            }

            @Override
            public double openRiskTotal(String accountId) {
                return 0.0;
            }
        };
    }
}
