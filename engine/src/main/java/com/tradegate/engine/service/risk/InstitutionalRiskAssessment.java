package com.tradegate.engine.service.risk;

import java.util.List;

public record InstitutionalRiskAssessment(
        boolean executionAllowed,
        boolean hardBlocked,
        List<String> hardBlockReasons,
        double irs,
        InstitutionalRiskMode riskMode,
        Capital capital,
        Drawdown drawdown,
        Correlation correlation,
        Volatility volatility,
        Behavior behavior,
        Sizing sizing,
        List<String> allowed,
        List<String> blocked
) {

    public record Capital(double usedPercent, double openRiskPercent, double proposedRiskPercent,
                          double dailyRiskPercent, double maxRiskPerTrade, double maxDailyRisk,
                          double maxOpenRisk, boolean blocked, String reason, double score) {
    }

    public record Drawdown(double dailyR, double sizeMultiplier, boolean aPlusOnly, boolean lockout,
                           double score, String action) {
    }

    public record Correlation(String cluster, int correlatedCount, int maxCorrelated, boolean blocked,
                              CorrelationSeverity severity, double score, String reason) {
    }

    public record Volatility(VolatilityRegime regime, boolean breakoutBlocked, double sizeMultiplier, double score) {
    }

    public record Behavior(boolean cooldownActive, int cooldownMinutes, boolean overtradingBlocked,
                           boolean ruleViolationBlocked, double score, String reason) {
    }

    public record Sizing(double baseSize, double flowStateMultiplier, double riskGovernorMultiplier,
                         double personalPerformanceMultiplier, double finalSize) {
    }
}
