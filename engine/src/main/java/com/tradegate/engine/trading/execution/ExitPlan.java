package com.tradegate.engine.trading.execution;

import com.tradegate.engine.model.TradeDirection;

public record ExitPlan(
        double stopPrice,
        double takeProfit1,
        Double takeProfit2,
        TrailRule trailRule,
        int timeStopMinutes,
        double rrAtTp1,
        Double rrAtTp2
) {

    /**
     * Stop and first target finite, positive and on the right side of entry, with at least 1:1 at TP1.
     */
    public boolean isValidFor(TradeDirection direction, double entryPrice) {
        if (!Double.isFinite(stopPrice) || stopPrice <= 0
                || !Double.isFinite(takeProfit1) || takeProfit1 <= 0
                || !Double.isFinite(rrAtTp1) || rrAtTp1 < 1) {
            return false;
        }
        if (direction == TradeDirection.SHORT) {
            return stopPrice > entryPrice && takeProfit1 < entryPrice;
        }
        return stopPrice < entryPrice && takeProfit1 > entryPrice;
    }
}
