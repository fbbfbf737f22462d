package com.tradegate.engine.trading.execution;

import com.tradegate.engine.config.RiskProperties;
import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.OptionsStructure;
import com.tradegate.engine.model.TradeIntent;
import com.tradegate.engine.service.risk.PermissionMatrixService;
import com.tradegate.engine.service.risk.PermissionSnapshot;
import com.tradegate.engine.util.DecimalUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs every execution stage for an intent and assembles a reviewable proposal. Unlike the
 * pipeline it does not stop at the first failing stage.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeProposalService {

    private final IntentValidator intentValidator;
    private final ExitPlanBuilder exitPlanBuilder;
    private final PermissionMatrixService permissionMatrixService;
    private final ExecutionRiskGovernor executionRiskGovernor;
    private final LeverageSelector leverageSelector;
    private final PositionSizingService positionSizingService;
    private final OptionsSelector optionsSelector;
    private final OrderBuilder orderBuilder;
    private final RiskProperties riskProperties;

    public TradeProposal propose(ProposalRequest request) {
        TradeIntent intent = request.getIntent();
        Instant now = request.getAsOf() == null ? Instant.now() : request.getAsOf();
        String proposalId = UUID.randomUUID().toString();

        List<ValidationError> intentErrors = intentValidator.validateIntent(intent);
        if (!intentErrors.isEmpty()) {
            String codes = intentErrors.stream().map(ValidationError::code).collect(Collectors.joining(", "));
            log.info("Rejected invalid intent {}: {}", intent.getSymbol(), codes);
            return new TradeProposal(proposalId, now, intent, null, null, null, null, null, null,
                    List.copyOf(intentErrors), false, "BLOCKED: " + codes);
        }

        ExitPlan exits = exitPlanBuilder.build(intent);
        PermissionSnapshot snapshot = permissionMatrixService.buildSnapshot(request.getPermissionContext());
        GovernorDecision governor = executionRiskGovernor.evaluate(intent, exits, snapshot, request.getExposure());

        double atrPercent = intent.getAtr() / intent.getEntryPrice() * 100;
        LeverageResult leverage = leverageSelector.select(intent.getAssetClass(), intent.getRegime(),
                governor.riskMode(), atrPercent, intent.getLeverage());

        PositionSizingResult sizing = positionSizingService.size(intent, new PositionSizingService.SizingLimits(
                exits.stopPrice(), governor.riskPerTrade(), governor.maxPositionSize(), leverage.recommendedLeverage()));

        OptionsSelection options = null;
        if (intent.getAssetClass() == AssetClass.OPTIONS
                || (intent.getOptionsStructure() != null && intent.getOptionsStructure() != OptionsStructure.NONE)) {
            options = optionsSelector.select(intent, sizing.totalRiskUsd());
        }

        LocalDate tradeDate = LocalDate.ofInstant(now, ZoneId.of(riskProperties.getFlow().getMarketZone()));
        OrderInstruction order = orderBuilder.build(intent, sizing, exits, leverage, options, proposalId,
                request.getMode(), tradeDate);

        TradeProposal draft = new TradeProposal(proposalId, now, intent, governor, sizing, exits, leverage, options,
                order, List.of(), false, "");
        List<ValidationError> errors = intentValidator.validateProposal(draft);
        boolean executable = governor.allowed() && errors.stream().noneMatch(ValidationError::isBlocking);

        String summary = summary(intent, sizing, exits, leverage, options, governor, errors, executable);
        log.info("Proposal {} for {}: {}", proposalId, intent.getSymbol(), summary);
        return new TradeProposal(proposalId, now, intent, governor, sizing, exits, leverage, options, order,
                List.copyOf(errors), executable, summary);
    }

    static String summary(TradeIntent intent, PositionSizingResult sizing, ExitPlan exits, LeverageResult leverage,
                          OptionsSelection options, GovernorDecision governor, List<ValidationError> errors,
                          boolean executable) {
        List<String> parts = new ArrayList<>();
        parts.add(String.format("%s %s x %s @ %s", intent.getDirection(), intent.getSymbol(),
                quantity(sizing.quantity()), intent.getEntryPrice()));
        parts.add(String.format("Stop %s -> TP1 %s", exits.stopPrice(), exits.takeProfit1()));
        parts.add(String.format("Risk $%.2f (%s%%)", sizing.totalRiskUsd(), DecimalUtils.pct(sizing.riskPct(), 2)));
        parts.add(String.format("R:R %s:1", exits.rrAtTp1()));
        if (leverage.isLeveraged()) {
            parts.add(String.format("Leverage %sx", quantity(leverage.recommendedLeverage())));
        }
        if (options != null) {
            parts.add(String.format("Options: %s %dDTE %.2f delta", options.structure(), options.dte(), options.delta()));
        }
        if (executable) {
            parts.add("EXECUTABLE");
        } else {
            List<String> codes = !governor.allowed()
                    ? governor.reasonCodes()
                    : errors.stream().filter(ValidationError::isBlocking).map(ValidationError::code).toList();
            parts.add("BLOCKED: " + String.join(", ", codes));
        }
        return String.join(" | ", parts);
    }

    private static String quantity(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
