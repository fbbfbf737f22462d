package com.tradegate.engine.model;

public enum DataHealthStatus {
    OK,
    DEGRADED,
    DOWN
}
