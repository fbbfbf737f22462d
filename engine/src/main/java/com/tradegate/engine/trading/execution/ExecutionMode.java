package com.tradegate.engine.trading.execution;

public enum ExecutionMode {
    DRY_RUN,
    PAPER,
    LIVE
}
