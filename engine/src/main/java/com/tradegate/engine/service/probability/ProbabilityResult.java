package com.tradegate.engine.service.probability;

import java.util.List;

public record ProbabilityResult(
        double winProbability,
        int winProbabilityPercent,
        ConvictionLabel label,
        SignalBias direction,
        int alignedCount,
        int opposedCount,
        int totalSignals,
        int confluenceScore,
        double logOdds,
        double rewardRisk,
        boolean kellyEligible,
        double kellyFraction,
        double kellySizePercent,
        List<String> kellyGateFailures,
        List<SignalContribution> contributions
) {
}
