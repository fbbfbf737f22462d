package com.tradegate.engine.trading.execution;

/**
 * Current account exposure. Percentages are fractions of equity.
 */
public record ExposureSnapshot(double dailyLossPct, double portfolioHeatPct, int openTradeCount) {

    public static ExposureSnapshot none() {
        return new ExposureSnapshot(0, 0, 0);
    }
}
