package com.tradegate.engine.trading.execution;

import com.tradegate.engine.config.ExecutionProperties;
import com.tradegate.engine.config.RiskProperties;
import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.OptionsStructure;
import com.tradegate.engine.model.StrategyTag;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.model.TradeIntent;
import com.tradegate.engine.service.risk.PatternClusterResolver;
import com.tradegate.engine.service.risk.PermissionContext;
import com.tradegate.engine.service.risk.PermissionMatrixService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TradeProposalServiceTest {

    private static final Instant MARKET_OPEN = Instant.parse("2026-03-02T15:00:00Z");

    private TradeProposalService service;

    private final PermissionContext trendUp = PermissionContext.builder().regime(MarketRegime.TREND_UP).build();

    @BeforeEach
    void setUp() {
        RiskProperties riskProperties = new RiskProperties();
        ExecutionProperties executionProperties = new ExecutionProperties();
        PermissionMatrixService matrix = new PermissionMatrixService(
                riskProperties, executionProperties, new PatternClusterResolver(riskProperties));
        service = new TradeProposalService(
                new IntentValidator(executionProperties),
                new ExitPlanBuilder(),
                matrix,
                new ExecutionRiskGovernor(matrix, executionProperties),
                new LeverageSelector(),
                new PositionSizingService(executionProperties),
                new OptionsSelector(),
                new OrderBuilder(),
                riskProperties);
    }

    @Test
    void equityLongIsExecutable() {
        TradeProposal proposal = service.propose(ProposalRequest.builder()
                .intent(intent(AssetClass.EQUITY).build())
                .permissionContext(trendUp)
                .asOf(MARKET_OPEN)
                .build());

        assertThat(proposal.executable()).isTrue();
        assertThat(proposal.validationErrors()).isEmpty();
        assertThat(proposal.timestamp()).isEqualTo(MARKET_OPEN);
        assertEquals(250.0, proposal.sizing().quantity());
        assertEquals(2.25, proposal.leverage().recommendedLeverage());
        assertEquals(OrderSide.BUY, proposal.order().getSide());
        assertEquals(ExecutionMode.DRY_RUN, proposal.order().getExecutionMode());
        assertEquals("LONG AAPL x 250 @ 100.0 | Stop 97.0 -> TP1 107.2 | Risk $750.00 (0.75%) | R:R 2.4:1"
                + " | Leverage 2.25x | EXECUTABLE", proposal.summary());
    }

    @Test
    void optionsIntentGetsContractOrder() {
        TradeProposal proposal = service.propose(ProposalRequest.builder()
                .intent(intent(AssetClass.OPTIONS).build())
                .permissionContext(trendUp)
                .mode(ExecutionMode.PAPER)
                .asOf(MARKET_OPEN)
                .build());

        assertThat(proposal.options().structure()).isEqualTo(OptionsStructure.LONG_CALL);
        assertThat(proposal.leverage().isLeveraged()).isFalse();
        assertEquals(1.0, proposal.order().getQuantity());
        assertEquals(OptionType.CALL, proposal.order().getOptionType());
        assertEquals(100.0, proposal.order().getStrike());
        assertEquals(LocalDate.of(2026, 4, 1), proposal.order().getExpiration());
        assertThat(proposal.summary()).contains("Options: LONG_CALL 30DTE 0.55 delta");
    }

    @Test
    void exposureBreachIsNotExecutable() {
        TradeProposal proposal = service.propose(ProposalRequest.builder()
                .intent(intent(AssetClass.EQUITY).build())
                .permissionContext(trendUp)
                .exposure(new ExposureSnapshot(0.021, 0, 0))
                .asOf(MARKET_OPEN)
                .build());

        assertThat(proposal.executable()).isFalse();
        assertThat(proposal.order()).isNotNull();
        assertThat(proposal.validationErrors()).extracting(ValidationError::code).contains("GOVERNOR_BLOCKED");
        assertThat(proposal.summary()).endsWith("BLOCKED: POLICY_CLEAR, EXEC_DAILY_LOSS_CAP");
    }

    @Test
    void invalidIntentStopsBeforeAnyStage() {
        TradeProposal proposal = service.propose(ProposalRequest.builder()
                .intent(intent(AssetClass.EQUITY).entryPrice(-1).build())
                .build());

        assertThat(proposal.executable()).isFalse();
        assertThat(proposal.exits()).isNull();
        assertThat(proposal.order()).isNull();
        assertThat(proposal.summary()).isEqualTo("BLOCKED: POSITIVE");
        assertThat(proposal.proposalId()).isNotBlank();
    }

    private static TradeIntent.TradeIntentBuilder intent(AssetClass assetClass) {
        return TradeIntent.builder()
                .symbol("AAPL")
                .assetClass(assetClass)
                .direction(TradeDirection.LONG)
                .strategyTag(StrategyTag.TREND_PULLBACK)
                .regime(MarketRegime.TREND_UP)
                .confidence(75)
                .entryPrice(100)
                .atr(2);
    }
}
