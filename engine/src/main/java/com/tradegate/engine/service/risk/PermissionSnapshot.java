package com.tradegate.engine.service.risk;

import com.tradegate.engine.model.DataHealthStatus;
import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.Permission;
import com.tradegate.engine.model.RiskMode;
import com.tradegate.engine.model.StrategyTag;
import com.tradegate.engine.model.TradeDirection;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record PermissionSnapshot(
        boolean guardEnabled,
        RiskMode riskMode,
        MarketRegime regime,
        SessionBudget session,
        DataHealth dataHealth,
        Caps caps,
        Map<StrategyTag, Map<TradeDirection, Permission>> matrix,
        List<GlobalBlock> globalBlocks,
        Instant timestamp
) {

    public Permission permissionFor(StrategyTag strategy, TradeDirection direction) {
        Map<TradeDirection, Permission> cell = matrix.get(strategy);
        if (cell == null || direction == null) {
            return Permission.BLOCK;
        }
        return cell.getOrDefault(direction, Permission.BLOCK);
    }

    public boolean hasGlobalBlock(String code) {
        return globalBlocks.stream().anyMatch(block -> block.code().equals(code));
    }

    public record SessionBudget(
            double remainingDailyR,
            double maxDailyR,
            double openRiskR,
            double maxOpenRiskR,
            int consecutiveLosses,
            int tradesToday,
            int maxTradesPerDay,
            boolean tradeCountBlocked
    ) {
    }

    public record DataHealth(DataHealthStatus status, long ageSeconds) {
    }

    public record Caps(
            double riskPerTrade,
            double grossMax,
            double netMax,
            boolean addOnsAllowed
    ) {
    }

    public record GlobalBlock(String code, Severity severity, String message) {

        public enum Severity {
            WARN,
            BLOCK
        }
    }
}
