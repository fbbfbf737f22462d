package com.tradegate.engine.trading.execution;

public enum OptionType {
    CALL,
    PUT
}
