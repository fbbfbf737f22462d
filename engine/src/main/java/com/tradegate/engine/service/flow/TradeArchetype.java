package com.tradegate.engine.service.flow;

import com.tradegate.engine.model.StrategyTag;

public enum TradeArchetype {
    TREND_CONTINUATION,
    BREAKOUT_EARLY,
    BREAKOUT_LATE,
    PULLBACK_ENTRY,
    MEAN_REVERSION,
    COUNTER_TREND_FADE,
    REVERSAL_CONFIRMED,
    MOMENTUM_ADD;

    public boolean isBreakout() {
        return this == BREAKOUT_EARLY || this == BREAKOUT_LATE;
    }

    public static TradeArchetype fromStrategy(StrategyTag strategy) {
        if (strategy == null) {
            return TREND_CONTINUATION;
        }
        return switch (strategy) {
            case TREND_PULLBACK -> PULLBACK_ENTRY;
            case BREAKOUT_CONTINUATION -> BREAKOUT_EARLY;
            case MEAN_REVERSION -> MEAN_REVERSION;
            case RANGE_FADE -> COUNTER_TREND_FADE;
            case MOMENTUM_REVERSAL -> REVERSAL_CONFIRMED;
            case EVENT_STRATEGY -> MOMENTUM_ADD;
        };
    }
}
