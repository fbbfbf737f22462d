package com.tradegate.engine.service.risk;

public enum InstitutionalRiskMode {
    FULL_OFFENSE(1.0),
    NORMAL(0.85),
    DEFENSIVE(0.6),
    LOCKDOWN(0.0);

    private final double sizeMultiplier;

    InstitutionalRiskMode(double sizeMultiplier) {
        this.sizeMultiplier = sizeMultiplier;
    }

    public double sizeMultiplier() {
        return sizeMultiplier;
    }

    public static InstitutionalRiskMode fromIrs(double irs) {
        if (irs >= 0.85) {
            return FULL_OFFENSE;
        }
        if (irs >= 0.70) {
            return NORMAL;
        }
        return irs >= 0.50 ? DEFENSIVE : LOCKDOWN;
    }
}
