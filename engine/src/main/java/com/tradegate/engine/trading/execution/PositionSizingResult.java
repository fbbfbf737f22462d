package com.tradegate.engine.trading.execution;

/**
 * {@code rawQuantity} is the pure equity-risk quantity before any cap or lot rounding.
 */
public record PositionSizingResult(
        double quantity,
        double rawQuantity,
        double riskPerUnit,
        double totalRiskUsd,
        double accountEquity,
        double riskPct,
        double notionalUsd,
        double leverage,
        boolean governorCapped,
        boolean notionalCapped
) {
}
