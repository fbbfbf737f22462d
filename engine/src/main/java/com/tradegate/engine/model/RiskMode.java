package com.tradegate.engine.model;

public enum RiskMode {
    NORMAL(1.0),
    THROTTLED(0.5),
    DEFENSIVE(0.35),
    LOCKED(0.0);

    private final double riskMultiplier;

    RiskMode(double riskMultiplier) {
        this.riskMultiplier = riskMultiplier;
    }

    public double riskMultiplier() {
        return riskMultiplier;
    }
}
