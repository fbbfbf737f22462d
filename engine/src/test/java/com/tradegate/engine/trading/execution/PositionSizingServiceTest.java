package com.tradegate.engine.trading.execution;

import com.tradegate.engine.config.ExecutionProperties;
import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.StrategyTag;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.model.TradeIntent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PositionSizingServiceTest {

    private final PositionSizingService service = new PositionSizingService(new ExecutionProperties());

    @Test
    void equityRiskQuantityIsCappedByNotional() {
        PositionSizingResult result = service.size(intent().build(), PositionSizingService.SizingLimits.none());

        assertThat(result.rawQuantity()).isEqualTo(375.0);
        assertThat(result.quantity()).isEqualTo(250.0);
        assertThat(result.notionalCapped()).isTrue();
        assertThat(result.notionalUsd()).isEqualTo(25_000.0);
        assertThat(result.totalRiskUsd()).isEqualTo(500.0);
    }

    @Test
    void leverageWidensNotionalCap() {
        PositionSizingResult result = service.size(intent().build(),
                new PositionSizingService.SizingLimits(null, null, null, 2.0));

        assertThat(result.quantity()).isEqualTo(375.0);
        assertThat(result.notionalCapped()).isFalse();
        assertThat(result.totalRiskUsd()).isEqualTo(750.0);
        assertThat(result.leverage()).isEqualTo(2.0);
    }

    @Test
    void governorMaxSizeWins() {
        PositionSizingResult result = service.size(intent().build(),
                new PositionSizingService.SizingLimits(null, null, 100L, 4.0));

        assertThat(result.quantity()).isEqualTo(100.0);
        assertThat(result.governorCapped()).isTrue();
    }

    @Test
    void governorRiskAppliesWhenIntentHasNone() {
        PositionSizingResult result = service.size(intent().riskPct(null).build(),
                new PositionSizingService.SizingLimits(null, 0.0038, null, 4.0));

        assertThat(result.riskPct()).isEqualTo(0.0038);
        assertThat(result.quantity()).isEqualTo(190.0);
    }

    @Test
    void cryptoRoundsDownToFourDecimals() {
        PositionSizingResult result = service.size(intent()
                .assetClass(AssetClass.CRYPTO)
                .accountEquity(10_000.0)
                .riskPct(0.01)
                .entryPrice(30_000)
                .stopPrice(29_000.0)
                .build(), PositionSizingService.SizingLimits.none());

        assertThat(result.quantity()).isEqualTo(0.0833);
    }

    @Test
    void forexRoundsToThousandUnitLots() {
        PositionSizingResult result = service.size(intent()
                .assetClass(AssetClass.FOREX)
                .riskPct(0.01)
                .entryPrice(1.10)
                .stopPrice(1.09)
                .build(), PositionSizingService.SizingLimits.none());

        assertThat(result.quantity()).isEqualTo(22_000.0);
    }

    @Test
    void missingStopFallsBackToAtrMultiple() {
        PositionSizingResult result = service.size(intent()
                .assetClass(AssetClass.CRYPTO)
                .stopPrice(null)
                .atr(2)
                .build(), PositionSizingService.SizingLimits.none());

        assertThat(result.riskPerUnit()).isEqualTo(4.0);
    }

    @Test
    void riskAndNotionalStayWithinBudgetAcrossStops() {
        double equity = 100_000;
        double riskPct = 0.0075;
        for (double stop = 99.9; stop > 80; stop -= 0.7) {
            for (double leverage : new double[]{1.0, 2.5, 4.0}) {
                PositionSizingResult result = service.size(intent().stopPrice(stop).build(),
                        new PositionSizingService.SizingLimits(null, null, null, leverage));
                assertThat(result.totalRiskUsd()).isLessThanOrEqualTo(equity * riskPct + 0.01);
                assertThat(result.notionalUsd()).isLessThanOrEqualTo(equity * 0.25 * leverage + 0.01);
            }
        }
    }

    @Test
    void kellyCeilingNeverExceedsRiskBudget() {
        assertThat(service.kellyMaxRisk(100_000, 0.01, 0.6, 2.0, 1.0)).isCloseTo(1_000.0, within(1e-6));
        assertThat(service.kellyMaxRisk(100_000, 0.05, 0.6, 2.0, 1.0)).isCloseTo(5_000.0, within(1e-6));
        assertThat(service.kellyMaxRisk(100_000, 0.01, 0.4, 1.0, 1.0)).isZero();
        assertThat(service.kellyMaxRisk(100_000, 0.01, 0.6, 2.0, 0.0)).isCloseTo(1_000.0, within(1e-6));
    }

    private static TradeIntent.TradeIntentBuilder intent() {
        return TradeIntent.builder()
                .symbol("AAPL")
                .assetClass(AssetClass.EQUITY)
                .direction(TradeDirection.LONG)
                .strategyTag(StrategyTag.TREND_PULLBACK)
                .regime(MarketRegime.TREND_UP)
                .confidence(75)
                .entryPrice(100)
                .atr(2)
                .stopPrice(98.0)
                .accountEquity(100_000.0)
                .riskPct(0.0075);
    }
}
