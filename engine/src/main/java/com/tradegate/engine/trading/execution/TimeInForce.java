package com.tradegate.engine.trading.execution;

public enum TimeInForce {
    DAY,
    GTC,
    IOC
}
