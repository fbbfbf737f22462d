package com.tradegate.engine.service.risk;

import com.tradegate.engine.model.Permission;
import com.tradegate.engine.model.RiskMode;

import java.time.Instant;
import java.util.List;

public record CandidateEvaluation(
        Permission permission,
        RiskMode riskMode,
        double riskPerTrade,
        long maxPositionSize,
        double requiredStopMinDistance,
        Constraints constraints,
        List<String> requiredActions,
        List<String> reasonCodes,
        Instant timestamp
) {

    public boolean permitsEntry() {
        return permission.permitsEntry();
    }

    public record Constraints(
            double maxGrossExposure,
            double maxNetExposure,
            double maxOpenRiskR,
            boolean noAddOns,
            boolean triggerOnly
    ) {
    }
}
