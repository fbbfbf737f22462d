package com.tradegate.engine.trading.execution;

import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.OptionsStructure;
import com.tradegate.engine.model.StrategyTag;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.model.TradeIntent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class OrderBuilderTest {

    private static final String PROPOSAL_ID = "3f2a9c1e-77aa-4c1b-9d2e-0a1b2c3d4e5f";
    private static final LocalDate TRADE_DATE = LocalDate.of(2026, 3, 2);

    private final OrderBuilder builder = new OrderBuilder();

    private final ExitPlan exits = new ExitPlan(97.0, 107.2, 112.0, TrailRule.CHANDELIER, 390, 2.4, 4.0);
    private final PositionSizingResult sizing = new PositionSizingResult(
            250, 375, 3, 750, 100_000, 0.0075, 25_000, 1, false, true);

    @Test
    void equityLongIsDayLimitBracket() {
        OrderInstruction order = builder.build(intent(AssetClass.EQUITY, TradeDirection.LONG), sizing, exits,
                new LeverageResult(1, 1, false, false, null), null, PROPOSAL_ID, ExecutionMode.PAPER, TRADE_DATE);

        assertEquals(OrderSide.BUY, order.getSide());
        assertEquals(OrderType.LIMIT, order.getOrderType());
        assertEquals(TimeInForce.DAY, order.getTimeInForce());
        assertEquals(250.0, order.getQuantity());
        assertEquals(100.0, order.getLimitPrice());
        assertEquals(97.0, order.getBracketStop());
        assertEquals(107.2, order.getBracketTp1());
        assertEquals(112.0, order.getBracketTp2());
        assertEquals("TG-3f2a9c1e-AAPL", order.getClientOrderId());
        assertEquals(ExecutionMode.PAPER, order.getExecutionMode());
        assertThat(order.getLeverage()).isNull();
        assertThat(order.getOptionType()).isNull();
    }

    @Test
    void cryptoShortIsGoodTillCancelledWithLeverage() {
        OrderInstruction order = builder.build(intent(AssetClass.CRYPTO, TradeDirection.SHORT), sizing,
                new ExitPlan(103.0, 92.8, null, TrailRule.ATR_2X, 1440, 2.4, null),
                new LeverageResult(5, 2.5, false, false, null), null, PROPOSAL_ID, null, TRADE_DATE);

        assertEquals(OrderSide.SELL, order.getSide());
        assertEquals(TimeInForce.GTC, order.getTimeInForce());
        assertEquals(2.5, order.getLeverage());
        assertEquals(ExecutionMode.DRY_RUN, order.getExecutionMode());
        assertThat(order.getBracketTp2()).isNull();
    }

    @Test
    void optionsOrderCarriesContractTerms() {
        OptionsSelection options = new OptionsSelection(OptionsStructure.LONG_CALL, 30, 0.55, 101.3, 3.94, 394, 394, List.of());

        OrderInstruction order = builder.build(intent(AssetClass.OPTIONS, TradeDirection.LONG), sizing, exits,
                null, options, PROPOSAL_ID, ExecutionMode.DRY_RUN, TRADE_DATE);

        assertEquals(OptionType.CALL, order.getOptionType());
        assertEquals(100.0, order.getStrike());
        assertEquals(LocalDate.of(2026, 4, 1), order.getExpiration());
        assertEquals(1.0, order.getQuantity());
    }

    @Test
    void optionsExpiryDefaultsToTodayWhenTradeDateMissing() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T15:00:00Z"), ZoneId.of("America/New_York"));
        OrderBuilder clocked = new OrderBuilder(clock);
        OptionsSelection options = new OptionsSelection(OptionsStructure.LONG_CALL, 30, 0.55, 101.3, 3.94, 394, 394, List.of());

        OrderInstruction order = clocked.build(intent(AssetClass.OPTIONS, TradeDirection.LONG), sizing, exits,
                null, options, PROPOSAL_ID, ExecutionMode.DRY_RUN, null);

        assertEquals(LocalDate.of(2026, 4, 1), order.getExpiration());
    }

    @Test
    void strikeIncrementsFollowPriceBands() {
        assertEquals(99.0, OrderBuilder.roundStrike(99.4));
        assertEquals(100.0, OrderBuilder.roundStrike(101.3));
        assertEquals(235.0, OrderBuilder.roundStrike(237));
        assertEquals(510.0, OrderBuilder.roundStrike(512));
    }

    @Test
    void optionTypeFollowsStructureThenDirection() {
        assertEquals(OptionType.PUT, OrderBuilder.optionType(OptionsStructure.PUT_DEBIT_SPREAD, TradeDirection.LONG));
        assertEquals(OptionType.CALL, OrderBuilder.optionType(OptionsStructure.CALL_DEBIT_SPREAD, TradeDirection.SHORT));
        assertEquals(OptionType.PUT, OrderBuilder.optionType(OptionsStructure.STRADDLE, TradeDirection.SHORT));
    }

    @Test
    void contractsFloorAgainstPerContractLoss() {
        OptionsSelection options = new OptionsSelection(OptionsStructure.STRADDLE, 45, 0.55, 100, 4.83, 966, 966, List.of());

        assertEquals(2.0, OrderBuilder.contracts(options, 2_000));
        assertEquals(0.0, OrderBuilder.contracts(options, 900));
        assertEquals("TG-short-X", OrderBuilder.clientOrderId("short", "X"));
    }

    private static TradeIntent intent(AssetClass assetClass, TradeDirection direction) {
        return TradeIntent.builder()
                .symbol("AAPL")
                .assetClass(assetClass)
                .direction(direction)
                .strategyTag(StrategyTag.TREND_PULLBACK)
                .regime(MarketRegime.TREND_UP)
                .confidence(75)
                .entryPrice(100)
                .atr(2)
                .build();
    }
}
