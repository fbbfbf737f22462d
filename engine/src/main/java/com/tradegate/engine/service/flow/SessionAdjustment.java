package com.tradegate.engine.service.flow;

public record SessionAdjustment(
        SessionPhase phase,
        double tpsAdjustment,
        boolean sizeCapApplied,
        boolean restrictive,
        String reason
) {
}
