package com.tradegate.engine.service.probability;

import com.tradegate.engine.model.TradeDirection;

public enum SignalBias {
    BULLISH,
    BEARISH,
    NEUTRAL;

    public static SignalBias of(TradeDirection direction) {
        if (direction == null) {
            return NEUTRAL;
        }
        return direction == TradeDirection.LONG ? BULLISH : BEARISH;
    }

    /**
     * +1 when this bias agrees with {@code requested}, -1 when it opposes it, 0 when either is neutral.
     */
    public int signRelativeTo(SignalBias requested) {
        if (this == NEUTRAL || requested == null || requested == NEUTRAL) {
            return 0;
        }
        return this == requested ? 1 : -1;
    }
}
