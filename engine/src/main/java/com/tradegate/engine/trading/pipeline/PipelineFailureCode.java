package com.tradegate.engine.trading.pipeline;

public enum PipelineFailureCode {
    NO_ATR,
    ACCOUNT_DATA_UNAVAILABLE,
    BAD_EXITS,
    RISK_LOCKED,
    GOVERNOR_BLOCK
}
