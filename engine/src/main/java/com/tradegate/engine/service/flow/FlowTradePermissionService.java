package com.tradegate.engine.service.flow;

import com.tradegate.engine.config.RiskProperties;
import com.tradegate.engine.util.DecimalUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a flow state and requested archetype into a trade permission score (TPS) and verdict.
 * A session overlay is applied last and can only tighten the verdict.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FlowTradePermissionService {

    private final RiskProperties riskProperties;

    public FlowPermission evaluate(FlowPermissionInput input) {
        RiskProperties.Flow cfg = riskProperties.getFlow();
        FlowState state = input.getState() != null ? input.getState() : FlowState.NEUTRAL;
        TradeArchetype archetype = input.getPreferredArchetype() != null
                ? input.getPreferredArchetype()
                : TradeArchetype.TREND_CONTINUATION;
        StatePolicy policy = policyFor(state);

        double alignment = state.alignment(archetype);
        double baseTps = DecimalUtils.clamp01(input.getInstitutionalProbability() / 100) * 0.5
                + alignment * 0.3
                + DecimalUtils.clamp01(input.getDataHealthScore() / 100) * 0.1
                + DecimalUtils.clamp01(input.getLiquidityClarity() / 100) * 0.1;

        boolean lowVolatility = input.getVolatilityCompression() >= 70 && input.getAtrExpansionRate() <= 35;
        boolean unclearLiquidity = input.getLiquidityClarity() < 45;
        boolean staleData = input.getDataHealthScore() < cfg.getStaleDataHealth();
        boolean noTradeMode = (state == FlowState.ACCUMULATION && lowVolatility && unclearLiquidity) || staleData;

        double baseThreshold = cfg.getTpsThreshold();
        boolean blocked = noTradeMode || baseTps < baseThreshold;
        String reason;
        if (noTradeMode && staleData) {
            reason = "NO-TRADE MODE: data health stale";
        } else if (noTradeMode) {
            reason = "NO-TRADE MODE: accumulation + low volatility + unclear liquidity";
        } else if (baseTps < baseThreshold) {
            reason = belowThreshold(baseTps, baseThreshold);
        } else {
            reason = "Permission granted";
        }

        SessionOverlay overlay = input.getSessionOverlay();
        double tps = baseTps;
        double size = policy.size();
        StopStyle stopStyle = policy.stopStyle();
        List<String> allowed = new ArrayList<>(policy.allowed());
        List<String> blockedTrades = new ArrayList<>(policy.blocked());
        SessionAdjustment adjustment = null;

        if (overlay != null) {
            tps = DecimalUtils.clamp01(baseTps + overlay.tpsAdjustment() / 100);
            double threshold = Math.max(baseThreshold, overlay.minimumTps() / 100);
            boolean failsConfidence = overlay.minimumConfidence() > 0
                    && input.getStateConfidence() < overlay.minimumConfidence();
            boolean failsLiquidity = overlay.minimumLiquidityClarity() > 0
                    && input.getLiquidityClarity() < overlay.minimumLiquidityClarity();

            if (!blocked) {
                if (failsConfidence) {
                    blocked = true;
                    reason = String.format("BLOCKED: %s requires state confidence %.0f", overlay.phase(), overlay.minimumConfidence());
                } else if (failsLiquidity) {
                    blocked = true;
                    reason = String.format("BLOCKED: %s requires liquidity clarity %.0f", overlay.phase(), overlay.minimumLiquidityClarity());
                } else if (tps < threshold) {
                    blocked = true;
                    reason = belowThreshold(tps, threshold);
                }
            }

            allowed.addAll(overlay.sessionAllowed());
            blockedTrades.addAll(overlay.sessionBlocked());
            if (overlay.stopStyleOverride() != null) {
                stopStyle = overlay.stopStyleOverride();
            }
        }

        if (blocked) {
            size = Math.min(size, cfg.getBlockedSizeCap());
        }
        boolean sizeCapApplied = false;
        if (overlay != null) {
            if (size > overlay.sizeMultiplierCap()) {
                size = overlay.sizeMultiplierCap();
                sizeCapApplied = true;
            }
            adjustment = new SessionAdjustment(overlay.phase(), overlay.tpsAdjustment(), sizeCapApplied,
                    overlay.restrictive(), overlay.reason());
        }

        if (blocked) {
            log.debug("Flow permission blocked for {} / {}: {}", state, archetype, reason);
        }

        return new FlowPermission(
                state,
                DecimalUtils.round1(tps * 100),
                blocked,
                noTradeMode,
                reason,
                blocked ? FlowRiskLevel.HIGH : policy.riskLevel(),
                DecimalUtils.round2(size),
                stopStyle,
                Collections.unmodifiableList(allowed),
                Collections.unmodifiableList(blockedTrades),
                alignmentTable(state),
                archetype,
                adjustment
        );
    }

    private static String belowThreshold(double tps, double threshold) {
        return String.format("BLOCKED: Trade Permission Score %d below threshold (%d)",
                Math.round(tps * 100), Math.round(threshold * 100));
    }

    private static Map<TradeArchetype, Double> alignmentTable(FlowState state) {
        Map<TradeArchetype, Double> table = new EnumMap<>(TradeArchetype.class);
        for (TradeArchetype archetype : TradeArchetype.values()) {
            table.put(archetype, state.alignment(archetype));
        }
        return Collections.unmodifiableMap(table);
    }

    private static StatePolicy policyFor(FlowState state) {
        return switch (state) {
            case ACCUMULATION -> new StatePolicy(0.4, StopStyle.TIGHT_STRUCTURAL, FlowRiskLevel.LOW,
                    List.of("Range bounces at liquidity edges", "VWAP reversion", "Fade extremes (high confidence)"),
                    List.of("Breakout chasing", "Momentum entries", "Late trend continuation"));
            case POSITIONING -> new StatePolicy(0.7, StopStyle.STRUCTURAL, FlowRiskLevel.MEDIUM,
                    List.of("Pullbacks aligned with bias", "Early breakout prep", "Compression break alerts"),
                    List.of("Late breakout entries", "Counter-trend scalps"));
            case LAUNCH -> new StatePolicy(1.0, StopStyle.ATR_TRAILING, FlowRiskLevel.HIGH,
                    List.of("Trend continuation", "Breakout retests", "Momentum add-ons"),
                    List.of("Counter-trend fades", "Early reversal guesses"));
            case EXHAUSTION -> new StatePolicy(0.5, StopStyle.WIDER_CONFIRMATION, FlowRiskLevel.MEDIUM,
                    List.of("Profit-taking", "Confirmed reversals", "Mean reversion to VWAP"),
                    List.of("New trend entries", "Breakout continuation"));
            case NEUTRAL -> new StatePolicy(0.5, StopStyle.STRUCTURAL, FlowRiskLevel.MEDIUM,
                    List.of("Wait for state confirmation"),
                    List.of("Aggressive continuation entries"));
        };
    }

    private record StatePolicy(double size, StopStyle stopStyle, FlowRiskLevel riskLevel,
                               List<String> allowed, List<String> blocked) {
    }
}
