package com.tradegate.engine.service.confluence;

import java.util.List;
import java.util.Map;

public record ConfluenceResult(
        ScoringRegime regime,
        ConfluenceComponents components,
        Map<ConfluenceComponent, Double> weights,
        double rawScore,
        double weightedScore,
        List<String> gateViolations,
        boolean gated,
        TradeBias tradeBias,
        Map<ConfluenceComponent, Double> breakdown
) {
}
