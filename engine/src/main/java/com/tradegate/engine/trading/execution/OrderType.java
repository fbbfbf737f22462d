package com.tradegate.engine.trading.execution;

public enum OrderType {
    MARKET,
    LIMIT,
    STOP,
    STOP_LIMIT
}
