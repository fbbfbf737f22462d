package com.tradegate.engine.trading.pipeline;

/**
 * {@code dynamicR} is the dollar value of 1R for this account; {@code normalizedR} expresses it in
 * units of 1R on the default account so trades on different account sizes compare.
 */
public record EntryRiskMetrics(double equityAtEntry, double riskPerTradeAtEntry, double dynamicR, double normalizedR) {
}
