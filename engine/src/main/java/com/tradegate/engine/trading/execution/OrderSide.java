package com.tradegate.engine.trading.execution;

public enum OrderSide {
    BUY,
    SELL
}
