package com.tradegate.engine.service.risk;

import com.tradegate.engine.config.RiskProperties;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.util.DecimalUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Institutional risk score (IRS): five weighted sub-scores that decide sizing. Any single hard
 * block stops execution whatever the composite says.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InstitutionalRiskGovernor {

    static final double CAPITAL_WEIGHT = 0.30;
    static final double DRAWDOWN_WEIGHT = 0.25;
    static final double CORRELATION_WEIGHT = 0.20;
    static final double VOLATILITY_WEIGHT = 0.15;
    static final double BEHAVIOR_WEIGHT = 0.10;

    private static final int COOLDOWN_MINUTES = 30;

    private final RiskProperties riskProperties;
    private final ClusterResolver clusterResolver;

    public InstitutionalRiskAssessment evaluate(InstitutionalRiskInput input) {
        RiskProperties.Institutional cfg = riskProperties.getInstitutional();
        List<String> hardBlockReasons = new ArrayList<>();

        InstitutionalRiskAssessment.Capital capital = capital(input.getAccount(), cfg);
        if (capital.blocked()) {
            hardBlockReasons.add("CAPITAL: " + capital.reason());
        }

        InstitutionalRiskAssessment.Drawdown drawdown = drawdown(input.getAccount().dailyR(), input.getConviction(), input.getTps());
        if (drawdown.lockout()) {
            hardBlockReasons.add("DRAWDOWN: " + drawdown.action());
        }

        InstitutionalRiskAssessment.Correlation correlation = correlation(input, cfg.getMaxCorrelated());
        if (correlation.blocked()) {
            hardBlockReasons.add("CORRELATION: " + correlation.reason());
        }

        VolatilityRegime volatilityRegime = input.getVolatilityOverride() != null
                ? input.getVolatilityOverride()
                : VolatilityRegime.classify(input.getAtrPercent(), input.getExpansionProbability(), input.getExpansionAcceleration());
        boolean breakoutBlocked = volatilityRegime == VolatilityRegime.EXTREME
                && input.getPreferredArchetype() != null
                && input.getPreferredArchetype().isBreakout();
        if (breakoutBlocked) {
            hardBlockReasons.add("VOLATILITY: EXTREME regime blocks breakout entries");
        }
        InstitutionalRiskAssessment.Volatility volatility = new InstitutionalRiskAssessment.Volatility(
                volatilityRegime, breakoutBlocked, volatilityRegime.sizeMultiplier(), volatilityRegime.score());

        InstitutionalRiskAssessment.Behavior behavior = behavior(input.getBehavior());
        if (behavior.cooldownActive() || behavior.overtradingBlocked() || behavior.ruleViolationBlocked()) {
            hardBlockReasons.add("BEHAVIOR: " + behavior.reason());
        }

        double irs = DecimalUtils.clamp01(
                capital.score() * CAPITAL_WEIGHT
                        + drawdown.score() * DRAWDOWN_WEIGHT
                        + correlation.score() * CORRELATION_WEIGHT
                        + volatility.score() * VOLATILITY_WEIGHT
                        + behavior.score() * BEHAVIOR_WEIGHT);
        InstitutionalRiskMode mode = InstitutionalRiskMode.fromIrs(irs);
        if (mode == InstitutionalRiskMode.LOCKDOWN) {
            hardBlockReasons.add("IRS: Lockdown mode (< 0.50)");
        }

        boolean hardBlocked = !hardBlockReasons.isEmpty();
        double expectancy = input.getBehavior().expectancyR();
        double personal = DecimalUtils.round2(expectancy < 0 ? DecimalUtils.clamp01(0.85 + expectancy * 0.2) : 1.0);
        double governorMultiplier = mode.sizeMultiplier();
        double finalSize = DecimalUtils.round2(
                input.getFlowSizeMultiplier()
                        * (hardBlocked ? 0.0 : governorMultiplier)
                        * drawdown.sizeMultiplier()
                        * volatility.sizeMultiplier()
                        * personal);

        if (hardBlocked) {
            log.debug("Institutional governor blocked {}: {}", input.getSymbol(), hardBlockReasons);
        }

        return new InstitutionalRiskAssessment(
                !hardBlocked,
                hardBlocked,
                List.copyOf(hardBlockReasons),
                DecimalUtils.round2(irs),
                mode,
                capital,
                drawdown,
                correlation,
                volatility,
                behavior,
                new InstitutionalRiskAssessment.Sizing(1.0, input.getFlowSizeMultiplier(), governorMultiplier, personal, finalSize),
                allowedList(mode, drawdown),
                blockedList(mode, capital, drawdown, correlation, volatility, behavior)
        );
    }

    private InstitutionalRiskAssessment.Capital capital(InstitutionalRiskInput.AccountRisk account, RiskProperties.Institutional cfg) {
        double open = Math.max(0, account.openRiskPercent());
        double daily = Math.max(0, account.dailyRiskPercent());
        double proposed = Math.max(0, account.proposedRiskPercent());
        double openIfAccepted = open + proposed;
        double dailyIfAccepted = daily + proposed;

        String reason = "Within allocation";
        boolean blocked = true;
        if (proposed > cfg.getMaxRiskPerTradePct()) {
            reason = String.format("Per-trade risk exceeds %s%%", trim(cfg.getMaxRiskPerTradePct()));
        } else if (dailyIfAccepted > cfg.getMaxDailyRiskPct()) {
            reason = "Daily risk limit exceeded";
        } else if (openIfAccepted > cfg.getMaxOpenRiskPct()) {
            reason = "Open risk exceeds allocation";
        } else {
            blocked = false;
        }

        double utilization = Math.max(openIfAccepted / cfg.getMaxOpenRiskPct(),
                Math.max(dailyIfAccepted / cfg.getMaxDailyRiskPct(), proposed / cfg.getMaxRiskPerTradePct()));
        double score = DecimalUtils.clamp01(1 - utilization * 0.9);
        return new InstitutionalRiskAssessment.Capital(
                DecimalUtils.round2(DecimalUtils.clamp01(openIfAccepted / cfg.getMaxOpenRiskPct())),
                DecimalUtils.round2(open),
                DecimalUtils.round2(proposed),
                DecimalUtils.round2(daily),
                cfg.getMaxRiskPerTradePct(),
                cfg.getMaxDailyRiskPct(),
                cfg.getMaxOpenRiskPct(),
                blocked,
                reason,
                DecimalUtils.round2(score));
    }

    private InstitutionalRiskAssessment.Drawdown drawdown(double dailyR, double conviction, double tps) {
        double r = DecimalUtils.round2(dailyR);
        if (dailyR <= -5) {
            return new InstitutionalRiskAssessment.Drawdown(r, 0, false, true, 0.05,
                    "AUTO LOCKOUT: daily drawdown <= -5R");
        }
        if (dailyR <= -4) {
            boolean aPlus = conviction >= 82 && tps >= 78;
            return new InstitutionalRiskAssessment.Drawdown(r, aPlus ? 0.35 : 0, true, !aPlus, aPlus ? 0.35 : 0.2,
                    aPlus ? "ONLY A+ setups" : "A+ ONLY mode active; setup not qualified");
        }
        if (dailyR <= -3) {
            return new InstitutionalRiskAssessment.Drawdown(r, 0.5, false, false, 0.48,
                    "Size reduced to 50% (drawdown <= -3R)");
        }
        if (dailyR <= -2) {
            return new InstitutionalRiskAssessment.Drawdown(r, 0.75, false, false, 0.7,
                    "Size reduced to 75% (drawdown <= -2R)");
        }
        return new InstitutionalRiskAssessment.Drawdown(r, 1, false, false, 0.95, "Normal drawdown profile");
    }

    private InstitutionalRiskAssessment.Correlation correlation(InstitutionalRiskInput input, int maxCorrelated) {
        InstitutionalRiskInput.CorrelationPosition proposed = input.getProposedPosition();
        String cluster = proposed != null && proposed.cluster() != null
                ? proposed.cluster()
                : clusterResolver.resolve(input.getSymbol(), input.getAssetClass());
        TradeDirection direction = proposed != null && proposed.direction() != null ? proposed.direction() : TradeDirection.LONG;

        int count = (int) input.getOpenPositions().stream()
                .filter(position -> position.direction() == direction)
                .filter(position -> cluster.equals(position.cluster() != null
                        ? position.cluster()
                        : clusterResolver.resolve(position.symbol(), input.getAssetClass())))
                .count();

        boolean blocked = count >= maxCorrelated;
        CorrelationSeverity severity = count >= 2 ? CorrelationSeverity.HIGH
                : count == 1 ? CorrelationSeverity.MEDIUM
                : CorrelationSeverity.LOW;
        String reason = blocked
                ? "Max correlated exposure reached in " + cluster
                : String.format("Correlated exposure %d/%d in %s", count, maxCorrelated, cluster);
        double score = DecimalUtils.clamp01(1 - count / (double) (maxCorrelated + 1));
        return new InstitutionalRiskAssessment.Correlation(cluster, count, maxCorrelated, blocked, severity,
                DecimalUtils.round2(score), reason);
    }

    private InstitutionalRiskAssessment.Behavior behavior(InstitutionalRiskInput.BehaviorStats stats) {
        boolean cooldown = stats.consecutiveLosses() >= 3 && stats.lossesWindowMinutes() <= 20;
        boolean overtrading = stats.tradesThisSession() > 6 && stats.expectancyR() < 0;
        boolean violations = stats.ruleViolations() >= 2;
        String reason;
        if (cooldown) {
            reason = "COOLDOWN MODE: " + COOLDOWN_MINUTES + " minutes after rapid loss cluster";
        } else if (overtrading) {
            reason = "Overtrading detected with negative expectancy";
        } else if (violations) {
            reason = "Repeated rule violations detected";
        } else {
            reason = "Behavior stable";
        }
        double penalty = (cooldown ? 0.55 : 0) + (overtrading ? 0.35 : 0) + Math.min(0.25, stats.ruleViolations() * 0.08);
        return new InstitutionalRiskAssessment.Behavior(cooldown, cooldown ? COOLDOWN_MINUTES : 0, overtrading,
                violations, DecimalUtils.round2(DecimalUtils.clamp01(1 - penalty)), reason);
    }

    private static List<String> allowedList(InstitutionalRiskMode mode, InstitutionalRiskAssessment.Drawdown drawdown) {
        List<String> allowed = new ArrayList<>();
        allowed.add(drawdown.aPlusOnly()
                ? "A+ setups only while drawdown control active"
                : "Standard setups allowed within flow permissions");
        if (mode == InstitutionalRiskMode.DEFENSIVE) {
            allowed.add("Defensive sizing enforced");
        }
        if (mode == InstitutionalRiskMode.FULL_OFFENSE) {
            allowed.add("Full offense available under strong IRS");
        }
        return List.copyOf(allowed);
    }

    private static List<String> blockedList(InstitutionalRiskMode mode,
                                            InstitutionalRiskAssessment.Capital capital,
                                            InstitutionalRiskAssessment.Drawdown drawdown,
                                            InstitutionalRiskAssessment.Correlation correlation,
                                            InstitutionalRiskAssessment.Volatility volatility,
                                            InstitutionalRiskAssessment.Behavior behavior) {
        List<String> blocked = new ArrayList<>();
        if (correlation.blocked()) {
            blocked.add("New " + correlation.cluster() + " positions in the same direction");
        }
        if (volatility.breakoutBlocked()) {
            blocked.add("Breakout entries in EXTREME volatility");
        }
        if (behavior.cooldownActive()) {
            blocked.add("All new trades during " + COOLDOWN_MINUTES + "-minute cooldown");
        }
        if (behavior.overtradingBlocked()) {
            blocked.add("New trades: overtrading + negative expectancy");
        }
        if (behavior.ruleViolationBlocked()) {
            blocked.add("New trades after repeated rule violations");
        }
        if (drawdown.lockout()) {
            blocked.add("All trading lockout (drawdown governor)");
        }
        if (capital.blocked()) {
            blocked.add("New risk allocation (capital limits exceeded)");
        }
        if (mode == InstitutionalRiskMode.LOCKDOWN) {
            blocked.add("All new trades (IRS lockdown mode)");
        }
        return List.copyOf(blocked);
    }

    private static String trim(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
