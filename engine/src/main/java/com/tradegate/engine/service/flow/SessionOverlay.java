package com.tradegate.engine.service.flow;

import java.util.List;

/**
 * Time-of-day rules applied on top of the base flow permission. Gates at 0 are disabled.
 */
public record SessionOverlay(
        SessionPhase phase,
        boolean crypto,
        double tpsAdjustment,
        double sizeMultiplierCap,
        double riskUnitCap,
        List<String> sessionAllowed,
        List<String> sessionBlocked,
        StopStyle stopStyleOverride,
        double minimumConfidence,
        double minimumLiquidityClarity,
        double minimumTps,
        double slippageMultiplier,
        String reason,
        boolean restrictive
) {
}
