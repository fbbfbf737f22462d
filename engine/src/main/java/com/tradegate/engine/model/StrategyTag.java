package com.tradegate.engine.model;

public enum StrategyTag {
    TREND_PULLBACK,
    BREAKOUT_CONTINUATION,
    MEAN_REVERSION,
    RANGE_FADE,
    MOMENTUM_REVERSAL,
    EVENT_STRATEGY
}
