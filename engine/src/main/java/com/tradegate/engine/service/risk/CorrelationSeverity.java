package com.tradegate.engine.service.risk;

public enum CorrelationSeverity {
    LOW,
    MEDIUM,
    HIGH
}
