package com.tradegate.engine.service.flow;

public enum StopStyle {
    TIGHT_STRUCTURAL,
    STRUCTURAL,
    ATR_TRAILING,
    WIDER_CONFIRMATION
}
