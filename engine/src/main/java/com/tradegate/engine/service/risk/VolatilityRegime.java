package com.tradegate.engine.service.risk;

public enum VolatilityRegime {
    LOW(0.85, 0.66),
    NORMAL(1.0, 0.95),
    HIGH(0.8, 0.72),
    EXTREME(0.5, 0.4);

    private final double sizeMultiplier;
    private final double score;

    VolatilityRegime(double sizeMultiplier, double score) {
        this.sizeMultiplier = sizeMultiplier;
        this.score = score;
    }

    public double sizeMultiplier() {
        return sizeMultiplier;
    }

    public double score() {
        return score;
    }

    public static VolatilityRegime classify(double atrPercent, double expansionProbability, ExpansionAcceleration acceleration) {
        if (atrPercent >= 3.5 || (expansionProbability >= 74 && acceleration == ExpansionAcceleration.RISING)) {
            return EXTREME;
        }
        if (atrPercent >= 2.2 || expansionProbability >= 62) {
            return HIGH;
        }
        if (atrPercent <= 0.9 && expansionProbability <= 40) {
            return LOW;
        }
        return NORMAL;
    }
}
