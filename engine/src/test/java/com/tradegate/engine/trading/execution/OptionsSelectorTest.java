package com.tradegate.engine.trading.execution;

import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.OptionsStructure;
import com.tradegate.engine.model.StrategyTag;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.model.TradeIntent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OptionsSelectorTest {

    private final OptionsSelector selector = new OptionsSelector();

    @Test
    void trendingLongBuysThirtyDayCall() {
        OptionsSelection selection = selector.select(intent(MarketRegime.TREND_UP, TradeDirection.LONG, 72).build(), 750);

        assertThat(selection.structure()).isEqualTo(OptionsStructure.LONG_CALL);
        assertThat(selection.dte()).isEqualTo(30);
        assertThat(selection.delta()).isEqualTo(0.55);
        assertThat(selection.strike()).isEqualTo(100.0);
        assertThat(selection.premiumEstimate()).isEqualTo(3.94);
        assertThat(selection.maxLossPerContract()).isEqualTo(394.0);
        assertThat(selection.maxLossUsd()).isEqualTo(394.0);
        assertThat(selection.notesText()).contains("30 DTE from TREND_UP table");
    }

    @Test
    void stressedRegimeUsesDebitSpreads() {
        OptionsSelection bull = selector.select(intent(MarketRegime.VOL_EXPANSION, TradeDirection.LONG, 72).build(), 750);
        OptionsSelection bear = selector.select(intent(MarketRegime.VOL_EXPANSION, TradeDirection.SHORT, 72).build(), 750);

        assertThat(bull.structure()).isEqualTo(OptionsStructure.CALL_DEBIT_SPREAD);
        assertThat(bear.structure()).isEqualTo(OptionsStructure.PUT_DEBIT_SPREAD);
        assertThat(bull.dte()).isEqualTo(21);
        assertThat(bull.notes()).contains("Defined risk, max loss limited to the debit paid");
    }

    @Test
    void lowConvictionRangeSellsIronCondor() {
        OptionsSelection selection = selector.select(intent(MarketRegime.RANGE_NEUTRAL, TradeDirection.LONG, 60).build(), 750);

        assertThat(selection.structure()).isEqualTo(OptionsStructure.IRON_CONDOR);
        assertThat(selection.dte()).isEqualTo(14);
        assertThat(selection.delta()).isEqualTo(0.45);
    }

    @Test
    void straddleCountsBothLegs() {
        OptionsSelection selection = selector.select(intent(MarketRegime.VOL_CONTRACTION, TradeDirection.LONG, 75).build(), 2_000);

        assertThat(selection.structure()).isEqualTo(OptionsStructure.STRADDLE);
        assertThat(selection.dte()).isEqualTo(45);
        assertThat(selection.maxLossPerContract()).isCloseTo(selection.premiumEstimate() * 200, within(0.01));
    }

    @Test
    void callerChoicesOverrideTables() {
        OptionsSelection selection = selector.select(intent(MarketRegime.TREND_UP, TradeDirection.LONG, 90)
                .optionsStructure(OptionsStructure.LONG_PUT)
                .optionsDte(60)
                .optionsDelta(0.25)
                .build(), 750);

        assertThat(selection.structure()).isEqualTo(OptionsStructure.LONG_PUT);
        assertThat(selection.dte()).isEqualTo(60);
        assertThat(selection.delta()).isEqualTo(0.25);
    }

    @Test
    void contractAboveBudgetIsFlagged() {
        OptionsSelection selection = selector.select(intent(MarketRegime.TREND_UP, TradeDirection.LONG, 72).build(), 100);

        assertThat(selection.maxLossUsd()).isEqualTo(100.0);
        assertThat(selection.notesText()).contains("exceeds risk budget");
    }

    @Test
    void deltaSteps() {
        assertThat(OptionsSelector.defaultDelta(85)).isEqualTo(0.70);
        assertThat(OptionsSelector.defaultDelta(65)).isEqualTo(0.55);
        assertThat(OptionsSelector.defaultDelta(50)).isEqualTo(0.45);
        assertThat(OptionsSelector.defaultDelta(49.9)).isEqualTo(0.30);
        assertThat(OptionsSelector.defaultDte(MarketRegime.RISK_OFF_STRESS)).isEqualTo(7);
    }

    private static TradeIntent.TradeIntentBuilder intent(MarketRegime regime, TradeDirection direction, double confidence) {
        return TradeIntent.builder()
                .symbol("AAPL")
                .assetClass(AssetClass.OPTIONS)
                .direction(direction)
                .strategyTag(StrategyTag.TREND_PULLBACK)
                .regime(regime)
                .confidence(confidence)
                .entryPrice(100)
                .atr(2);
    }
}
