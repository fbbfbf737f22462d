package com.tradegate.engine.trading.execution;

import com.tradegate.engine.config.ExecutionProperties;
import com.tradegate.engine.model.Permission;
import com.tradegate.engine.model.TradeIntent;
import com.tradegate.engine.service.risk.CandidateEvaluation;
import com.tradegate.engine.service.risk.CandidateIntent;
import com.tradegate.engine.service.risk.PermissionMatrixService;
import com.tradegate.engine.service.risk.PermissionSnapshot;
import com.tradegate.engine.util.DecimalUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Execution-layer limits layered over the permission matrix verdict. Every limit is checked
 * even when the matrix approves.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExecutionRiskGovernor {

    private final PermissionMatrixService permissionMatrixService;
    private final ExecutionProperties properties;

    public GovernorDecision evaluate(TradeIntent intent, ExitPlan exits, PermissionSnapshot snapshot, ExposureSnapshot exposure) {
        CandidateIntent candidate = CandidateIntent.builder()
                .symbol(intent.getSymbol())
                .assetClass(intent.getAssetClass())
                .strategyTag(intent.getStrategyTag())
                .direction(intent.getDirection())
                .confidence(intent.getConfidence())
                .entryPrice(intent.getEntryPrice())
                .stopPrice(exits.stopPrice())
                .atr(intent.getAtr())
                .eventSeverity(intent.getEventSeverity())
                .openPositions(intent.getOpenPositions())
                .accountEquity(intent.getAccountEquity())
                .build();
        CandidateEvaluation evaluation = permissionMatrixService.evaluate(snapshot, candidate);

        ExposureSnapshot current = exposure == null ? ExposureSnapshot.none() : exposure;
        ExecutionProperties.Limits limits = properties.getLimits();
        boolean allowed = evaluation.permission() != Permission.BLOCK;
        List<String> codes = new ArrayList<>(evaluation.reasonCodes());
        List<String> actions = new ArrayList<>(evaluation.requiredActions());

        if (current.dailyLossPct() >= limits.getMaxDailyLossPct()) {
            allowed = false;
            codes.add("EXEC_DAILY_LOSS_CAP");
            actions.add(String.format("Daily loss %s%% >= %s%% cap, no new trades.",
                    DecimalUtils.pct(current.dailyLossPct(), 2), DecimalUtils.pct(limits.getMaxDailyLossPct(), 1)));
        }
        if (current.portfolioHeatPct() >= limits.getMaxPortfolioHeatPct()) {
            allowed = false;
            codes.add("EXEC_PORTFOLIO_HEAT");
            actions.add(String.format("Portfolio heat %s%% >= %s%%, reduce open risk.",
                    DecimalUtils.pct(current.portfolioHeatPct(), 2), DecimalUtils.pct(limits.getMaxPortfolioHeatPct(), 1)));
        }
        if (current.openTradeCount() >= limits.getMaxOpenTrades()) {
            allowed = false;
            codes.add("EXEC_MAX_OPEN_TRADES");
            actions.add(String.format("%d open trades >= %d hard cap.", current.openTradeCount(), limits.getMaxOpenTrades()));
        }
        if (exits.rrAtTp1() < limits.getMinRewardRisk()) {
            allowed = false;
            codes.add("EXEC_MIN_RR");
            actions.add(String.format("R:R at TP1 %.2f < %.1f minimum.", exits.rrAtTp1(), limits.getMinRewardRisk()));
        }
        double riskPct = intent.getRiskPct() != null ? intent.getRiskPct() : evaluation.riskPerTrade();
        if (riskPct > limits.getMaxSingleTradeRiskPct()) {
            allowed = false;
            codes.add("EXEC_SINGLE_TRADE_RISK");
            actions.add(String.format("Risk per trade %s%% > %s%% cap.",
                    DecimalUtils.pct(riskPct, 2), DecimalUtils.pct(limits.getMaxSingleTradeRiskPct(), 1)));
        }

        if (!allowed) {
            log.info("Execution governor blocked {} {}: {}", intent.getSymbol(), intent.getDirection(), codes);
        }
        return new GovernorDecision(
                allowed,
                allowed ? evaluation.permission() : Permission.BLOCK,
                evaluation.riskMode(),
                evaluation.riskPerTrade(),
                evaluation.maxPositionSize(),
                List.copyOf(codes),
                List.copyOf(actions),
                evaluation
        );
    }
}
