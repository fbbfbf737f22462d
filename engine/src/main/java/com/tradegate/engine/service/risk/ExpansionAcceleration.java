package com.tradegate.engine.service.risk;

public enum ExpansionAcceleration {
    RISING,
    FALLING,
    FLAT
}
