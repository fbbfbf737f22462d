package com.tradegate.engine.trading.pipeline;

import com.tradegate.engine.config.ExecutionProperties;
import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.OpenPosition;
import com.tradegate.engine.model.RiskMode;
import com.tradegate.engine.model.TradeIntent;
import com.tradegate.engine.service.GatingMetrics;
import com.tradegate.engine.service.risk.PermissionContext;
import com.tradegate.engine.service.risk.PermissionMatrixService;
import com.tradegate.engine.service.risk.PermissionSnapshot;
import com.tradegate.engine.trading.execution.ExecutionRiskGovernor;
import com.tradegate.engine.trading.execution.ExitPlan;
import com.tradegate.engine.trading.execution.ExitPlanBuilder;
import com.tradegate.engine.trading.execution.ExposureSnapshot;
import com.tradegate.engine.trading.execution.GovernorDecision;
import com.tradegate.engine.trading.execution.LeverageResult;
import com.tradegate.engine.trading.execution.LeverageSelector;
import com.tradegate.engine.trading.execution.PositionSizingResult;
import com.tradegate.engine.trading.execution.PositionSizingService;
import com.tradegate.engine.util.DecimalUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Entry pipeline: ATR, account state, exits, lock check, governor, leverage, sizing, entry risk.
 * The first failing stage ends the run; nothing is retried here.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExecutionPipelineService {

    private static final double DEFAULT_CONFIDENCE = 50.0;
    private static final double DEFAULT_ATR_PERCENT = 2.0;

    private final VolatilityProvider volatilityProvider;
    private final AccountDataProvider accountDataProvider;
    private final ExitPlanBuilder exitPlanBuilder;
    private final PermissionMatrixService permissionMatrixService;
    private final ExecutionRiskGovernor executionRiskGovernor;
    private final LeverageSelector leverageSelector;
    private final PositionSizingService positionSizingService;
    private final ExecutionProperties properties;
    private final GatingMetrics metrics;

    public PipelineResult run(PipelineRequest request) {
        PipelineResult result = execute(request);
        metrics.recordPipelineOutcome(result.ok() ? "OK" : result.failureCode().name());
        if (!result.ok()) {
            log.info("Pipeline stopped for {} at {}: {}", request.getSymbol(), result.failureCode(), result.reason());
        }
        return result;
    }

    private PipelineResult execute(PipelineRequest request) {
        String symbol = request.getSymbol();
        AssetClass assetClass = AssetClass.fromString(request.getAssetClass());
        MarketRegime regime = IntentAliases.regime(request.getRegime());

        OptionalDouble atr = resolveAtr(request, assetClass);
        if (atr.isEmpty()) {
            return PipelineResult.failure(PipelineFailureCode.NO_ATR,
                    String.format("No ATR available for %s, cannot compute exit strategy.", symbol));
        }

        double equity = resolveEquity(request.getAccountId());
        List<OpenPosition> positions;
        double dailyPnl;
        double openRisk;
        try {
            positions = accountDataProvider.openPositions(request.getAccountId());
            dailyPnl = accountDataProvider.dailyRealizedPnl(request.getAccountId());
            openRisk = accountDataProvider.openRiskTotal(request.getAccountId());
        } catch (RuntimeException e) {
            log.warn("Account data unavailable for {}: {}", request.getAccountId(), e.getMessage());
            return PipelineResult.failure(PipelineFailureCode.ACCOUNT_DATA_UNAVAILABLE,
                    String.format("Account data unavailable for %s, cannot evaluate exposure.", request.getAccountId()));
        }

        TradeIntent intent = TradeIntent.builder()
                .symbol(symbol)
                .assetClass(assetClass)
                .direction(request.getDirection())
                .strategyTag(IntentAliases.strategy(request.getStrategySource()))
                .confidence(request.getConfidence() == null ? DEFAULT_CONFIDENCE : request.getConfidence())
                .regime(regime)
                .entryPrice(request.getEntryPrice())
                .atr(atr.getAsDouble())
                .stopPrice(request.getStopPrice())
                .eventSeverity(request.getEventSeverity())
                .accountEquity(equity)
                .riskPct(request.getRiskPct())
                .leverage(request.getLeverage())
                .openPositions(positions == null ? List.of() : positions)
                .build();

        ExitPlan exits = exitPlanBuilder.build(intent);
        if (!exits.isValidFor(intent.getDirection(), intent.getEntryPrice())) {
            return PipelineResult.failure(PipelineFailureCode.BAD_EXITS,
                    String.format("Exit strategy invalid for %s, stop: %s, tp1: %s, R:R %s.",
                            symbol, exits.stopPrice(), exits.takeProfit1(), exits.rrAtTp1()));
        }

        PermissionSnapshot snapshot = permissionMatrixService.buildSnapshot(permissionContext(request, regime, assetClass, equity, dailyPnl, openRisk));
        if (snapshot.riskMode() == RiskMode.LOCKED) {
            return PipelineResult.failure(PipelineFailureCode.RISK_LOCKED, "Risk governor is LOCKED, no new entries.");
        }

        ExposureSnapshot exposure = new ExposureSnapshot(
                Math.abs(Math.min(0, dailyPnl)) / equity,
                Math.max(0, openRisk) / equity,
                intent.getOpenPositions().size());
        GovernorDecision governor = executionRiskGovernor.evaluate(intent, exits, snapshot, exposure);
        if (!governor.allowed()) {
            return PipelineResult.failure(PipelineFailureCode.GOVERNOR_BLOCK,
                    "Execution engine blocked: " + String.join(", ", governor.reasonCodes()),
                    governor.reasonCodes(), governor.requiredActions());
        }

        double atrPercent = intent.getEntryPrice() > 0 ? intent.getAtr() / intent.getEntryPrice() * 100 : DEFAULT_ATR_PERCENT;
        LeverageResult leverage = leverageSelector.select(assetClass, regime, governor.riskMode(), atrPercent, request.getLeverage());
        PositionSizingResult sizing = positionSizingService.size(intent, new PositionSizingService.SizingLimits(
                exits.stopPrice(), governor.riskPerTrade(), governor.maxPositionSize(), leverage.recommendedLeverage()));

        EntryRiskMetrics entryRisk = entryRisk(equity, sizing.riskPct());
        PipelineOutcome.TradeType tradeType = leverage.recommendedLeverage() > 1
                ? PipelineOutcome.TradeType.MARGIN
                : PipelineOutcome.TradeType.SPOT;
        log.info("Pipeline approved {} {} qty={} stop={} tp1={} lev={}x",
                intent.getDirection(), symbol, sizing.quantity(), exits.stopPrice(), exits.takeProfit1(), leverage.recommendedLeverage());
        return PipelineResult.success(new PipelineOutcome(intent, exits, governor, leverage, sizing, entryRisk, tradeType));
    }

    EntryRiskMetrics entryRisk(double equity, double riskPct) {
        double dynamicR = equity * riskPct;
        double baseR = properties.getDefaultEquity() * properties.getDefaultRiskPct();
        return new EntryRiskMetrics(equity, riskPct, DecimalUtils.round2(dynamicR), DecimalUtils.round(dynamicR / baseR, 4));
    }

    private OptionalDouble resolveAtr(PipelineRequest request, AssetClass assetClass) {
        if (request.getAtr() != null && request.getAtr() > 0) {
            return OptionalDouble.of(request.getAtr());
        }
        try {
            return volatilityProvider.fetchAtr(request.getSymbol(), assetClass);
        } catch (RuntimeException e) {
            log.warn("ATR fetch failed for {}: {}", request.getSymbol(), e.getMessage());
            return OptionalDouble.empty();
        }
    }

    private double resolveEquity(String accountId) {
        try {
            return accountDataProvider.latestEquity(accountId)
                    .filter(value -> value > 0)
                    .orElse(properties.getDefaultEquity());
        } catch (RuntimeException e) {
            log.warn("Equity lookup failed for {}, using default {}: {}", accountId, properties.getDefaultEquity(), e.getMessage());
            return properties.getDefaultEquity();
        }
    }

    private PermissionContext permissionContext(PipelineRequest request, MarketRegime regime, AssetClass assetClass,
                                                double equity, double dailyPnl, double openRisk) {
        PermissionContext base = request.getPermissionContext();
        if (base == null) {
            double oneR = equity * properties.getDefaultRiskPct();
            base = PermissionContext.builder()
                    .realizedDailyR(DecimalUtils.round2(dailyPnl / oneR))
                    .openRiskR(DecimalUtils.round2(Math.max(0, openRisk) / oneR))
                    .eventSeverity(request.getEventSeverity())
                    .build();
        }
        return base.toBuilder()
                .enabled(request.isGuardEnabled())
                .regime(regime)
                .assetClass(assetClass)
                .build();
    }
}
