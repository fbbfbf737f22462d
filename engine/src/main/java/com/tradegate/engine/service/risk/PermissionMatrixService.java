package com.tradegate.engine.service.risk;

import com.tradegate.engine.config.ExecutionProperties;
import com.tradegate.engine.config.RiskProperties;
import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.DataHealthStatus;
import com.tradegate.engine.model.EventSeverity;
import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.OpenPosition;
import com.tradegate.engine.model.Permission;
import com.tradegate.engine.model.RiskMode;
import com.tradegate.engine.model.StrategyTag;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.util.DecimalUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Hard permission governor: a regime permission matrix plus session-level locks.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PermissionMatrixService {

    private final RiskProperties riskProperties;
    private final ExecutionProperties executionProperties;
    private final ClusterResolver clusterResolver;

    public PermissionSnapshot buildSnapshot(PermissionContext context) {
        RiskProperties.PermissionMatrix cfg = riskProperties.getPermission();
        boolean enabled = context.isEnabled();
        MarketRegime regime = context.getRegime() != null ? context.getRegime() : MarketRegime.RANGE_NEUTRAL;
        double maxDailyR = context.isDailyBudgetHalved() ? cfg.getMaxDailyR() * 0.5 : cfg.getMaxDailyR();
        double remainingDailyR = Math.max(0.0, DecimalUtils.round2(maxDailyR + context.getRealizedDailyR()));

        RiskMode riskMode = inferRiskMode(context, remainingDailyR, cfg);
        List<PermissionSnapshot.GlobalBlock> globalBlocks = new ArrayList<>();
        if (enabled && context.getEventSeverity() == EventSeverity.HIGH) {
            globalBlocks.add(new PermissionSnapshot.GlobalBlock("EVENT_THROTTLE",
                    PermissionSnapshot.GlobalBlock.Severity.WARN, "High-impact event window active."));
        }
        if (enabled && riskMode == RiskMode.LOCKED) {
            globalBlocks.add(new PermissionSnapshot.GlobalBlock("RISK_LOCKED",
                    PermissionSnapshot.GlobalBlock.Severity.BLOCK, "Risk governor is LOCKED. New trades disabled."));
        }
        if (enabled && context.getDataStatus() == DataHealthStatus.DOWN) {
            globalBlocks.add(new PermissionSnapshot.GlobalBlock("DATA_DOWN",
                    PermissionSnapshot.GlobalBlock.Severity.BLOCK, "Market data feed unavailable."));
        } else if (enabled && context.getDataStatus() == DataHealthStatus.DEGRADED) {
            globalBlocks.add(new PermissionSnapshot.GlobalBlock("DATA_DEGRADED",
                    PermissionSnapshot.GlobalBlock.Severity.WARN, "Market data feed degraded."));
        }

        int maxTradesPerDay = context.getAssetClass() == AssetClass.CRYPTO
                ? cfg.getMaxTradesPerDayCrypto()
                : cfg.getMaxTradesPerDayEquity();
        boolean tradeCountBlocked = enabled && context.getTradesToday() >= maxTradesPerDay;
        if (tradeCountBlocked) {
            globalBlocks.add(new PermissionSnapshot.GlobalBlock("TRADE_COUNT_LIMIT",
                    PermissionSnapshot.GlobalBlock.Severity.BLOCK,
                    String.format("Daily trade count limit reached (%d/%d). No new trades allowed.",
                            context.getTradesToday(), maxTradesPerDay)));
        }

        RiskMode effectiveMode = enabled ? riskMode : RiskMode.NORMAL;
        boolean throttled = enabled && riskMode == RiskMode.THROTTLED;
        PermissionSnapshot.Caps caps = new PermissionSnapshot.Caps(
                DecimalUtils.round(cfg.getBaseRisk() * effectiveMode.riskMultiplier(), 4),
                throttled ? 1.2 : 1.5,
                throttled ? 0.7 : 0.8,
                effectiveMode == RiskMode.NORMAL
        );

        return new PermissionSnapshot(
                enabled,
                effectiveMode,
                regime,
                new PermissionSnapshot.SessionBudget(remainingDailyR, maxDailyR,
                        DecimalUtils.round2(context.getOpenRiskR()), cfg.getMaxOpenR(),
                        context.getConsecutiveLosses(), context.getTradesToday(), maxTradesPerDay, tradeCountBlocked),
                new PermissionSnapshot.DataHealth(context.getDataStatus(), Math.max(0, context.getDataAgeSeconds())),
                caps,
                enabled ? PermissionMatrix.forRegime(regime) : PermissionMatrix.allowAll(),
                List.copyOf(globalBlocks),
                Instant.now()
        );
    }

    public CandidateEvaluation evaluate(PermissionContext context, CandidateIntent candidate) {
        return evaluate(buildSnapshot(context), candidate);
    }

    public CandidateEvaluation evaluate(PermissionSnapshot snapshot, CandidateIntent candidate) {
        double equity = candidate.getAccountEquity() != null && candidate.getAccountEquity() > 0
                ? candidate.getAccountEquity()
                : executionProperties.getDefaultEquity();
        double stopDistance = Math.abs(candidate.getEntryPrice() - candidate.getStopPrice());
        double riskPerTrade = snapshot.caps().riskPerTrade();
        long maxPositionSize = Math.max(0L, (long) Math.floor(equity * riskPerTrade / Math.max(0.0001, stopDistance)));

        if (!snapshot.guardEnabled()) {
            return new CandidateEvaluation(Permission.ALLOW, RiskMode.NORMAL, riskPerTrade, maxPositionSize, 0.0,
                    constraints(snapshot, Permission.ALLOW), List.of(), List.of("GUARD_DISABLED"), Instant.now());
        }

        RiskProperties.PermissionMatrix cfg = riskProperties.getPermission();
        List<String> reasonCodes = new ArrayList<>();
        List<String> actions = new ArrayList<>();
        Permission permission = snapshot.permissionFor(candidate.getStrategyTag(), candidate.getDirection());

        if (snapshot.riskMode() == RiskMode.LOCKED) {
            permission = Permission.BLOCK;
            reasonCodes.add("RISK_MODE_LOCKED");
            actions.add("Reduce or close risk before new entries.");
        }
        if (snapshot.session().tradeCountBlocked()) {
            permission = Permission.BLOCK;
            reasonCodes.add("TRADE_COUNT_LIMIT");
            actions.add(String.format("Daily trade limit reached (%d/%d). No new trades allowed today.",
                    snapshot.session().tradesToday(), snapshot.session().maxTradesPerDay()));
        }
        if (snapshot.dataHealth().status() == DataHealthStatus.DOWN) {
            permission = Permission.BLOCK;
            reasonCodes.add("DATA_STALE");
            actions.add("Wait for feed recovery.");
        }
        if (candidate.getEventSeverity() == EventSeverity.HIGH && candidate.getStrategyTag() != StrategyTag.EVENT_STRATEGY) {
            permission = Permission.BLOCK;
            reasonCodes.add("EVENT_BLOCK");
            actions.add("Use EVENT_STRATEGY or wait until event window passes.");
        }

        int confidenceFloor = permission.confidenceFloor();
        if (candidate.getConfidence() < confidenceFloor) {
            permission = Permission.BLOCK;
            reasonCodes.add("CONFIDENCE_BELOW_THRESHOLD");
            actions.add(String.format("Raise setup quality to >= %d%% confidence.", confidenceFloor));
        }

        if (!candidate.getOpenPositions().isEmpty()) {
            String cluster = clusterResolver.resolve(candidate.getSymbol(), candidate.getAssetClass());
            long correlated = candidate.getOpenPositions().stream()
                    .filter(position -> position.direction() == candidate.getDirection())
                    .filter(position -> cluster.equals(clusterResolver.resolve(position.symbol(), assetClassOf(position, candidate))))
                    .count();
            int max = cfg.getMaxCorrelatedSameCluster();
            if (correlated >= max) {
                permission = Permission.BLOCK;
                reasonCodes.add("CORRELATED_CLUSTER_FULL");
                actions.add(String.format("Max %d %s positions in cluster %s. Close an existing position first.",
                        max, candidate.getDirection(), cluster));
            } else if (correlated == max - 1 && permission == Permission.ALLOW) {
                permission = Permission.ALLOW_REDUCED;
                reasonCodes.add("CORRELATED_CLUSTER_WARNING");
                actions.add(String.format("Approaching cluster limit for %s. Size reduced.", cluster));
            }
        }

        if (candidate.getDirection() == TradeDirection.LONG && candidate.getStopPrice() >= candidate.getEntryPrice()) {
            permission = Permission.BLOCK;
            reasonCodes.add("STOP_WRONG_SIDE");
            actions.add("LONG stop must be below entry price.");
        } else if (candidate.getDirection() == TradeDirection.SHORT && candidate.getStopPrice() <= candidate.getEntryPrice()) {
            permission = Permission.BLOCK;
            reasonCodes.add("STOP_WRONG_SIDE");
            actions.add("SHORT stop must be above entry price.");
        }
        if (candidate.getStopPrice() == candidate.getEntryPrice()) {
            permission = Permission.BLOCK;
            reasonCodes.add("STOP_EQUALS_ENTRY");
            actions.add("Stop price cannot equal entry price.");
        }

        double minStopDistance = minStopAtrMultiple(candidate.getStrategyTag(), candidate.getAssetClass()) * candidate.getAtr();
        if (stopDistance < minStopDistance) {
            permission = Permission.BLOCK;
            reasonCodes.add("STOP_TOO_TIGHT");
            actions.add(String.format("Widen stop to at least %.2f.", minStopDistance));
        }

        if (!snapshot.caps().addOnsAllowed() && permission != Permission.BLOCK) {
            reasonCodes.add("NO_ADD_ONS");
        }
        if (reasonCodes.isEmpty() && permission != Permission.BLOCK) {
            reasonCodes.add(switch (permission) {
                case ALLOW -> "POLICY_CLEAR";
                case ALLOW_REDUCED -> "SIZE_REDUCED";
                default -> "TRIGGER_ONLY";
            });
        }
        log.debug("Permission for {} {} {}: {} {}", candidate.getSymbol(), candidate.getStrategyTag(),
                candidate.getDirection(), permission, reasonCodes);

        return new CandidateEvaluation(
                permission,
                snapshot.riskMode(),
                riskPerTrade,
                maxPositionSize,
                DecimalUtils.round2(minStopDistance),
                constraints(snapshot, permission),
                List.copyOf(actions),
                List.copyOf(reasonCodes),
                Instant.now()
        );
    }

    static double minStopAtrMultiple(StrategyTag strategy, AssetClass assetClass) {
        if (strategy == null) {
            return 0.8;
        }
        boolean crypto = assetClass != null && assetClass.isCrypto();
        return switch (strategy) {
            case BREAKOUT_CONTINUATION, MOMENTUM_REVERSAL -> crypto ? 1.0 : 0.8;
            case TREND_PULLBACK, MEAN_REVERSION -> crypto ? 0.8 : 0.6;
            case RANGE_FADE -> crypto ? 0.7 : 0.5;
            case EVENT_STRATEGY -> crypto ? 0.9 : 0.8;
        };
    }

    private RiskMode inferRiskMode(PermissionContext context, double remainingDailyR, RiskProperties.PermissionMatrix cfg) {
        if (context.getDataStatus() == DataHealthStatus.DOWN
                || remainingDailyR <= 0
                || context.getOpenRiskR() >= cfg.getMaxOpenR()
                || context.getConsecutiveLosses() >= cfg.getLossStreakLock()) {
            return RiskMode.LOCKED;
        }
        if (context.getEventSeverity() == EventSeverity.HIGH || context.getConsecutiveLosses() >= cfg.getLossStreakThrottle()) {
            return RiskMode.THROTTLED;
        }
        return context.getDataStatus() == DataHealthStatus.DEGRADED ? RiskMode.DEFENSIVE : RiskMode.NORMAL;
    }

    private static CandidateEvaluation.Constraints constraints(PermissionSnapshot snapshot, Permission permission) {
        return new CandidateEvaluation.Constraints(
                snapshot.caps().grossMax(),
                snapshot.caps().netMax(),
                snapshot.session().maxOpenRiskR(),
                !snapshot.caps().addOnsAllowed(),
                permission == Permission.ALLOW_TIGHTENED
        );
    }

    private static AssetClass assetClassOf(OpenPosition position, CandidateIntent candidate) {
        return position.assetClass() != null ? position.assetClass() : candidate.getAssetClass();
    }
}
