package com.tradegate.engine.trading.pipeline;

import com.tradegate.engine.model.TradeIntent;
import com.tradegate.engine.trading.execution.ExitPlan;
import com.tradegate.engine.trading.execution.GovernorDecision;
import com.tradegate.engine.trading.execution.LeverageResult;
import com.tradegate.engine.trading.execution.PositionSizingResult;

public record PipelineOutcome(
        TradeIntent intent,
        ExitPlan exits,
        GovernorDecision governor,
        LeverageResult leverage,
        PositionSizingResult sizing,
        EntryRiskMetrics entryRisk,
        TradeType tradeType
) {

    public enum TradeType {
        MARGIN,
        SPOT
    }
}
