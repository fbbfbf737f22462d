package com.tradegate.engine.trading.pipeline;

import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.StrategyTag;

import java.util.Locale;
import java.util.Map;

/**
 * Free-text regime and signal-source names used by upstream producers.
 */
public final class IntentAliases {

    private static final Map<String, MarketRegime> REGIMES = Map.ofEntries(
            Map.entry("trend", MarketRegime.TREND_UP),
            Map.entry("trend up", MarketRegime.TREND_UP),
            Map.entry("bullish", MarketRegime.TREND_UP),
            Map.entry("trend down", MarketRegime.TREND_DOWN),
            Map.entry("bearish", MarketRegime.TREND_DOWN),
            Map.entry("range", MarketRegime.RANGE_NEUTRAL),
            Map.entry("neutral", MarketRegime.RANGE_NEUTRAL),
            Map.entry("volatility expansion", MarketRegime.VOL_EXPANSION),
            Map.entry("volatility contraction", MarketRegime.VOL_CONTRACTION),
            Map.entry("risk off", MarketRegime.RISK_OFF_STRESS),
            Map.entry("defensive", MarketRegime.RISK_OFF_STRESS)
    );

    private static final Map<String, StrategyTag> SOURCES = Map.of(
            "scanner_signal", StrategyTag.TREND_PULLBACK,
            "confluence_scan", StrategyTag.TREND_PULLBACK,
            "focus_plan", StrategyTag.TREND_PULLBACK,
            "strategy_signal", StrategyTag.BREAKOUT_CONTINUATION,
            "operator_signal", StrategyTag.BREAKOUT_CONTINUATION,
            "alert_intelligence", StrategyTag.MOMENTUM_REVERSAL
    );

    private IntentAliases() {
    }

    public static MarketRegime regime(String value) {
        if (value == null || value.isBlank()) {
            return MarketRegime.RANGE_NEUTRAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');
        MarketRegime alias = REGIMES.get(normalized);
        if (alias != null) {
            return alias;
        }
        for (MarketRegime regime : MarketRegime.values()) {
            if (regime.name().equalsIgnoreCase(value.trim())) {
                return regime;
            }
        }
        return MarketRegime.RANGE_NEUTRAL;
    }

    public static StrategyTag strategy(String value) {
        if (value == null || value.isBlank()) {
            return StrategyTag.TREND_PULLBACK;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        StrategyTag alias = SOURCES.get(normalized);
        if (alias != null) {
            return alias;
        }
        for (StrategyTag tag : StrategyTag.values()) {
            if (tag.name().equalsIgnoreCase(value.trim())) {
                return tag;
            }
        }
        return StrategyTag.TREND_PULLBACK;
    }
}
