package com.tradegate.engine.service.flow;

public enum FlowRiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
