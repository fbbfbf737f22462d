package com.tradegate.engine.model;

public enum MarketRegime {
    TREND_UP,
    TREND_DOWN,
    RANGE_NEUTRAL,
    VOL_EXPANSION,
    VOL_CONTRACTION,
    RISK_OFF_STRESS;

    public boolean isTrending() {
        return this == TREND_UP || this == TREND_DOWN;
    }

    public boolean isStressed() {
        return this == VOL_EXPANSION || this == RISK_OFF_STRESS;
    }
}
