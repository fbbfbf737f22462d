package com.tradegate.engine.trading.execution;

import com.tradegate.engine.model.TradeIntent;

import java.time.Instant;
import java.util.List;

/**
 * Every stage result for one intent. Stage fields are {@code null} when the intent failed validation.
 */
public record TradeProposal(
        String proposalId,
        Instant timestamp,
        TradeIntent intent,
        GovernorDecision governor,
        PositionSizingResult sizing,
        ExitPlan exits,
        LeverageResult leverage,
        OptionsSelection options,
        OrderInstruction order,
        List<ValidationError> validationErrors,
        boolean executable,
        String summary
) {
}
