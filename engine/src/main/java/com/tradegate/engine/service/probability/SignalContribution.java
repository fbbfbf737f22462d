package com.tradegate.engine.service.probability;

public record SignalContribution(
        SignalType type,
        SignalBias bias,
        boolean triggered,
        double confidence,
        double damping,
        double logOddsDelta,
        String reason
) {
}
