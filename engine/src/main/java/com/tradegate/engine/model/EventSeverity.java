package com.tradegate.engine.model;

public enum EventSeverity {
    NONE,
    MEDIUM,
    HIGH
}
