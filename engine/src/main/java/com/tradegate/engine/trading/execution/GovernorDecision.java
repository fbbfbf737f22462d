package com.tradegate.engine.trading.execution;

import com.tradegate.engine.model.Permission;
import com.tradegate.engine.model.RiskMode;
import com.tradegate.engine.service.risk.CandidateEvaluation;

import java.util.List;

public record GovernorDecision(
        boolean allowed,
        Permission permission,
        RiskMode riskMode,
        double riskPerTrade,
        long maxPositionSize,
        List<String> reasonCodes,
        List<String> requiredActions,
        CandidateEvaluation evaluation
) {
}
