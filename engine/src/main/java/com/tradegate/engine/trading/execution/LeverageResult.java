package com.tradegate.engine.trading.execution;

public record LeverageResult(
        double maxLeverage,
        double recommendedLeverage,
        boolean capped,
        boolean elevatedRisk,
        String capReason
) {

    public boolean isLeveraged() {
        return recommendedLeverage > 1;
    }
}
