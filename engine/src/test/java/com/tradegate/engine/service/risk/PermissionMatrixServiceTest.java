package com.tradegate.engine.service.risk;

import com.tradegate.engine.config.ExecutionProperties;
import com.tradegate.engine.config.RiskProperties;
import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.EventSeverity;
import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.OpenPosition;
import com.tradegate.engine.model.Permission;
import com.tradegate.engine.model.RiskMode;
import com.tradegate.engine.model.StrategyTag;
import com.tradegate.engine.model.TradeDirection;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PermissionMatrixServiceTest {

    private final RiskProperties riskProperties = new RiskProperties();
    private final PermissionMatrixService service = new PermissionMatrixService(
            riskProperties, new ExecutionProperties(), new PatternClusterResolver(riskProperties));

    private final PermissionContext trendUp = PermissionContext.builder().regime(MarketRegime.TREND_UP).build();

    @Test
    void alignedPullbackIsAllowedWithRiskBudget() {
        CandidateEvaluation evaluation = service.evaluate(trendUp, candidate().build());

        assertThat(evaluation.permission()).isEqualTo(Permission.ALLOW);
        assertThat(evaluation.reasonCodes()).containsExactly("POLICY_CLEAR");
        assertThat(evaluation.riskPerTrade()).isEqualTo(0.0075);
        assertThat(evaluation.maxPositionSize()).isEqualTo(250L);
        assertThat(evaluation.requiredStopMinDistance()).isEqualTo(1.2);
    }

    @Test
    void missingRegimeFallsBackToRangeNeutral() {
        PermissionContext unknown = PermissionContext.builder().regime(null).build();
        PermissionContext neutral = PermissionContext.builder().regime(MarketRegime.RANGE_NEUTRAL).build();

        PermissionSnapshot snapshot = service.buildSnapshot(unknown);

        assertThat(snapshot.regime()).isEqualTo(MarketRegime.RANGE_NEUTRAL);
        assertThat(snapshot.matrix()).isEqualTo(service.buildSnapshot(neutral).matrix());
        assertThat(PermissionMatrix.forRegime(null)).isEqualTo(PermissionMatrix.forRegime(MarketRegime.RANGE_NEUTRAL));
        assertThat(service.evaluate(unknown, candidate().build()).permission())
                .isEqualTo(service.evaluate(neutral, candidate().build()).permission());
    }

    @Test
    void counterTrendShortIsBlockedByMatrix() {
        CandidateEvaluation evaluation = service.evaluate(trendUp, candidate()
                .direction(TradeDirection.SHORT)
                .stopPrice(103)
                .build());

        assertThat(evaluation.permission()).isEqualTo(Permission.BLOCK);
        assertThat(evaluation.permitsEntry()).isFalse();
    }

    @Test
    void exhaustedDailyBudgetLocksEverything() {
        PermissionContext context = trendUp.toBuilder().realizedDailyR(-2.0).build();

        PermissionSnapshot snapshot = service.buildSnapshot(context);
        CandidateEvaluation evaluation = service.evaluate(snapshot, candidate().build());

        assertThat(snapshot.riskMode()).isEqualTo(RiskMode.LOCKED);
        assertThat(snapshot.hasGlobalBlock("RISK_LOCKED")).isTrue();
        assertThat(snapshot.caps().riskPerTrade()).isZero();
        assertThat(evaluation.permission()).isEqualTo(Permission.BLOCK);
        assertThat(evaluation.reasonCodes()).contains("RISK_MODE_LOCKED");
    }

    @Test
    void halvedBudgetShrinksDailyR() {
        PermissionSnapshot snapshot = service.buildSnapshot(trendUp.toBuilder().dailyBudgetHalved(true).realizedDailyR(-0.5).build());

        assertThat(snapshot.session().maxDailyR()).isEqualTo(1.0);
        assertThat(snapshot.session().remainingDailyR()).isEqualTo(0.5);
        assertThat(snapshot.riskMode()).isEqualTo(RiskMode.NORMAL);
    }

    @Test
    void highImpactEventThrottlesAndBlocksNonEventStrategies() {
        PermissionContext context = trendUp.toBuilder().eventSeverity(EventSeverity.HIGH).build();

        PermissionSnapshot snapshot = service.buildSnapshot(context);
        CandidateEvaluation evaluation = service.evaluate(snapshot, candidate().eventSeverity(EventSeverity.HIGH).build());

        assertThat(snapshot.riskMode()).isEqualTo(RiskMode.THROTTLED);
        assertThat(snapshot.caps().riskPerTrade()).isEqualTo(0.0038);
        assertThat(evaluation.reasonCodes()).contains("EVENT_BLOCK");
        assertThat(evaluation.permission()).isEqualTo(Permission.BLOCK);
    }

    @Test
    void stopInsideAtrFloorIsTooTight() {
        CandidateEvaluation evaluation = service.evaluate(trendUp, candidate().stopPrice(99.5).build());

        assertThat(evaluation.permission()).isEqualTo(Permission.BLOCK);
        assertThat(evaluation.reasonCodes()).contains("STOP_TOO_TIGHT");
    }

    @Test
    void clusterExposureReducesThenBlocks() {
        CandidateEvaluation reduced = service.evaluate(trendUp, candidate()
                .openPosition(new OpenPosition("NVDA", TradeDirection.LONG, AssetClass.EQUITY))
                .build());
        CandidateEvaluation full = service.evaluate(trendUp, candidate()
                .openPosition(new OpenPosition("NVDA", TradeDirection.LONG, AssetClass.EQUITY))
                .openPosition(new OpenPosition("MSFT", TradeDirection.LONG, AssetClass.EQUITY))
                .build());

        assertThat(reduced.permission()).isEqualTo(Permission.ALLOW_REDUCED);
        assertThat(reduced.reasonCodes()).contains("CORRELATED_CLUSTER_WARNING");
        assertThat(full.permission()).isEqualTo(Permission.BLOCK);
        assertThat(full.reasonCodes()).contains("CORRELATED_CLUSTER_FULL");
    }

    @Test
    void disabledGuardAllowsEverything() {
        CandidateEvaluation evaluation = service.evaluate(trendUp.toBuilder().enabled(false).build(), candidate()
                .direction(TradeDirection.SHORT)
                .stopPrice(103)
                .build());

        assertThat(evaluation.permission()).isEqualTo(Permission.ALLOW);
        assertThat(evaluation.reasonCodes()).containsExactly("GUARD_DISABLED");
    }

    @Test
    void tradeCountLimitBlocksAfterQuota() {
        PermissionSnapshot snapshot = service.buildSnapshot(trendUp.toBuilder().tradesToday(8).build());

        assertThat(snapshot.session().tradeCountBlocked()).isTrue();
        assertThat(service.evaluate(snapshot, candidate().build()).reasonCodes()).contains("TRADE_COUNT_LIMIT");
    }

    private static CandidateIntent.CandidateIntentBuilder candidate() {
        return CandidateIntent.builder()
                .symbol("AAPL")
                .assetClass(AssetClass.EQUITY)
                .strategyTag(StrategyTag.TREND_PULLBACK)
                .direction(TradeDirection.LONG)
                .confidence(75)
                .entryPrice(100)
                .stopPrice(97)
                .atr(2);
    }
}
