package com.tradegate.engine.service.probability;

public enum ConvictionLabel {
    HIGH_CONVICTION("High Conviction"),
    STRONG("Strong"),
    MODERATE("Moderate"),
    WEAK("Weak"),
    UNFAVORABLE("Unfavorable"),
    NO_CLEAR_SIGNAL("No Clear Signal");

    private final String displayName;

    ConvictionLabel(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static ConvictionLabel fromPercent(int winProbabilityPercent) {
        if (winProbabilityPercent >= 72) {
            return HIGH_CONVICTION;
        }
        if (winProbabilityPercent >= 65) {
            return STRONG;
        }
        if (winProbabilityPercent >= 55) {
            return MODERATE;
        }
        if (winProbabilityPercent >= 45) {
            return WEAK;
        }
        return UNFAVORABLE;
    }
}
