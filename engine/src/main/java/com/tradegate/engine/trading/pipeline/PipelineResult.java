package com.tradegate.engine.trading.pipeline;

import java.util.List;

/**
 * Either an {@link PipelineOutcome} or a failure code with the reason and any governor codes.
 */
public record PipelineResult(
        boolean ok,
        PipelineOutcome outcome,
        PipelineFailureCode failureCode,
        String reason,
        List<String> reasonCodes,
        List<String> requiredActions
) {

    public static PipelineResult success(PipelineOutcome outcome) {
        return new PipelineResult(true, outcome, null, null, List.of(), List.of());
    }

    public static PipelineResult failure(PipelineFailureCode code, String reason) {
        return new PipelineResult(false, null, code, reason, List.of(code.name()), List.of());
    }

    public static PipelineResult failure(PipelineFailureCode code, String reason, List<String> reasonCodes, List<String> requiredActions) {
        return new PipelineResult(false, null, code, reason, List.copyOf(reasonCodes), List.copyOf(requiredActions));
    }
}
