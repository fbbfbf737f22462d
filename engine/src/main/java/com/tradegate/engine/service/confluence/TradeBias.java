package com.tradegate.engine.service.confluence;

public enum TradeBias {
    NEUTRAL,
    CONDITIONAL,
    VALID,
    HIGH_CONFLUENCE;

    public static TradeBias fromScore(double score) {
        if (Double.isNaN(score) || score < 55) {
            return NEUTRAL;
        }
        if (score < 70) {
            return CONDITIONAL;
        }
        if (score < 85) {
            return VALID;
        }
        return HIGH_CONFLUENCE;
    }
}
