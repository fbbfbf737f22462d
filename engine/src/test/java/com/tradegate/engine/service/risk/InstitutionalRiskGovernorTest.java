package com.tradegate.engine.service.risk;

import com.tradegate.engine.config.RiskProperties;
import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.service.flow.FlowState;
import com.tradegate.engine.service.flow.TradeArchetype;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InstitutionalRiskGovernorTest {

    private final RiskProperties riskProperties = new RiskProperties();
    private final InstitutionalRiskGovernor governor =
            new InstitutionalRiskGovernor(riskProperties, new PatternClusterResolver(riskProperties));

    @Test
    void healthyBookRunsAtFullOffense() {
        InstitutionalRiskAssessment assessment = governor.evaluate(base().build());

        assertThat(assessment.executionAllowed()).isTrue();
        assertThat(assessment.hardBlockReasons()).isEmpty();
        assertThat(assessment.irs()).isEqualTo(0.95);
        assertThat(assessment.riskMode()).isEqualTo(InstitutionalRiskMode.FULL_OFFENSE);
        assertThat(assessment.sizing().finalSize()).isEqualTo(1.0);
    }

    @Test
    void fiveRDrawdownLocksOutRegardlessOfOtherScores() {
        InstitutionalRiskAssessment assessment = governor.evaluate(base()
                .account(new InstitutionalRiskInput.AccountRisk(0, 0.1, 0, -5))
                .conviction(99)
                .tps(99)
                .build());

        assertThat(assessment.executionAllowed()).isFalse();
        assertThat(assessment.drawdown().lockout()).isTrue();
        assertThat(assessment.hardBlockReasons()).anyMatch(reason -> reason.startsWith("DRAWDOWN:"));
        assertThat(assessment.sizing().finalSize()).isZero();
    }

    @Test
    void fourRDrawdownAdmitsOnlyAPlusSetups() {
        InstitutionalRiskInput.AccountRisk account = new InstitutionalRiskInput.AccountRisk(0, 0.1, 0, -4.2);

        InstitutionalRiskAssessment qualified = governor.evaluate(base().account(account).conviction(85).tps(80).build());
        InstitutionalRiskAssessment unqualified = governor.evaluate(base().account(account).conviction(70).tps(80).build());

        assertThat(qualified.drawdown().aPlusOnly()).isTrue();
        assertThat(qualified.drawdown().lockout()).isFalse();
        assertThat(qualified.drawdown().sizeMultiplier()).isEqualTo(0.35);
        assertThat(unqualified.drawdown().lockout()).isTrue();
        assertThat(unqualified.executionAllowed()).isFalse();
    }

    @Test
    void perTradeCapitalBreachBlocks() {
        InstitutionalRiskAssessment assessment = governor.evaluate(base()
                .account(new InstitutionalRiskInput.AccountRisk(0, 1.5, 0, 0))
                .build());

        assertThat(assessment.capital().blocked()).isTrue();
        assertThat(assessment.hardBlockReasons()).contains("CAPITAL: Per-trade risk exceeds 1%");
    }

    @Test
    void twoCorrelatedPositionsBlockSameDirection() {
        InstitutionalRiskAssessment assessment = governor.evaluate(base()
                .openPosition(new InstitutionalRiskInput.CorrelationPosition("NVDA", TradeDirection.LONG, null))
                .openPosition(new InstitutionalRiskInput.CorrelationPosition("AMD", TradeDirection.LONG, null))
                .build());

        assertThat(assessment.correlation().cluster()).isEqualTo("AI_TECH");
        assertThat(assessment.correlation().correlatedCount()).isEqualTo(2);
        assertThat(assessment.correlation().severity()).isEqualTo(CorrelationSeverity.HIGH);
        assertThat(assessment.executionAllowed()).isFalse();
    }

    @Test
    void oppositeDirectionDoesNotCountAsCorrelated() {
        InstitutionalRiskAssessment assessment = governor.evaluate(base()
                .openPosition(new InstitutionalRiskInput.CorrelationPosition("NVDA", TradeDirection.SHORT, null))
                .openPosition(new InstitutionalRiskInput.CorrelationPosition("AMD", TradeDirection.SHORT, null))
                .build());

        assertThat(assessment.correlation().correlatedCount()).isZero();
        assertThat(assessment.correlation().blocked()).isFalse();
    }

    @Test
    void extremeVolatilityBlocksBreakoutsOnly() {
        InstitutionalRiskAssessment breakout = governor.evaluate(base()
                .atrPercent(4.0)
                .preferredArchetype(TradeArchetype.BREAKOUT_EARLY)
                .build());
        InstitutionalRiskAssessment pullback = governor.evaluate(base()
                .atrPercent(4.0)
                .preferredArchetype(TradeArchetype.PULLBACK_ENTRY)
                .build());

        assertThat(breakout.volatility().regime()).isEqualTo(VolatilityRegime.EXTREME);
        assertThat(breakout.volatility().breakoutBlocked()).isTrue();
        assertThat(breakout.executionAllowed()).isFalse();
        assertThat(pullback.volatility().breakoutBlocked()).isFalse();
        assertThat(pullback.volatility().sizeMultiplier()).isEqualTo(0.5);
    }

    @Test
    void rapidLossClusterTriggersCooldown() {
        InstitutionalRiskAssessment assessment = governor.evaluate(base()
                .behavior(new InstitutionalRiskInput.BehaviorStats(3, 15, 3, 0.2, 0))
                .build());

        assertThat(assessment.behavior().cooldownActive()).isTrue();
        assertThat(assessment.behavior().cooldownMinutes()).isEqualTo(30);
        assertThat(assessment.executionAllowed()).isFalse();
    }

    private static InstitutionalRiskInput.InstitutionalRiskInputBuilder base() {
        return InstitutionalRiskInput.builder()
                .assetClass(AssetClass.EQUITY)
                .symbol("AAPL")
                .flowState(FlowState.LAUNCH)
                .preferredArchetype(TradeArchetype.TREND_CONTINUATION)
                .conviction(75)
                .tps(75)
                .atrPercent(1.5)
                .expansionProbability(50)
                .account(new InstitutionalRiskInput.AccountRisk(0, 0.1, 0, 0))
                .proposedPosition(new InstitutionalRiskInput.CorrelationPosition("AAPL", TradeDirection.LONG, null));
    }
}
