package com.tradegate.engine.service.flow;

import java.util.List;
import java.util.Map;

public record FlowPermission(
        FlowState state,
        double tps,
        boolean blocked,
        boolean noTradeMode,
        String reason,
        FlowRiskLevel riskLevel,
        double sizeMultiplier,
        StopStyle stopStyle,
        List<String> allowed,
        List<String> blockedTrades,
        Map<TradeArchetype, Double> alignmentByArchetype,
        TradeArchetype selectedArchetype,
        SessionAdjustment sessionAdjustment
) {

    public boolean hasSessionAdjustment() {
        return sessionAdjustment != null;
    }
}
