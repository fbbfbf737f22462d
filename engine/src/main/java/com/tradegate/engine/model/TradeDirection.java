package com.tradegate.engine.model;

public enum TradeDirection {
    LONG,
    SHORT;

    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
