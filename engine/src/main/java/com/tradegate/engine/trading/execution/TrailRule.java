package com.tradegate.engine.trading.execution;

public enum TrailRule {
    NONE,
    ATR_1X,
    ATR_1_5X,
    ATR_2X,
    BREAKEVEN_AFTER_1R,
    CHANDELIER,
    PERCENT_TRAIL
}
