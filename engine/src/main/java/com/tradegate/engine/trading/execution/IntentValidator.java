package com.tradegate.engine.trading.execution;

import com.tradegate.engine.config.ExecutionProperties;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.model.TradeIntent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class IntentValidator {

    private static final double MAX_RISK_PCT = 0.10;
    private static final double MAX_LEVERAGE = 100.0;

    private final ExecutionProperties properties;

    public List<ValidationError> validateIntent(TradeIntent intent) {
        List<ValidationError> errors = new ArrayList<>();
        if (intent.getSymbol() == null || intent.getSymbol().isBlank()) {
            errors.add(new ValidationError("symbol", "REQUIRED", "Symbol is required."));
        }
        if (intent.getAssetClass() == null) {
            errors.add(new ValidationError("assetClass", "INVALID", "Asset class is required."));
        }
        if (intent.getDirection() == null) {
            errors.add(new ValidationError("direction", "INVALID", "Direction must be LONG or SHORT."));
        }
        if (intent.getStrategyTag() == null) {
            errors.add(new ValidationError("strategyTag", "INVALID", "Strategy tag is required."));
        }
        if (intent.getRegime() == null) {
            errors.add(new ValidationError("regime", "INVALID", "Market regime is required."));
        }
        if (intent.getConfidence() < 0 || intent.getConfidence() > 100 || Double.isNaN(intent.getConfidence())) {
            errors.add(new ValidationError("confidence", "RANGE", "Confidence must be between 0 and 100."));
        }
        if (!(intent.getEntryPrice() > 0)) {
            errors.add(new ValidationError("entryPrice", "POSITIVE", "Entry price must be positive."));
        }
        if (!(intent.getAtr() > 0)) {
            errors.add(new ValidationError("atr", "POSITIVE", "ATR must be positive."));
        }
        Double stop = intent.getStopPrice();
        if (stop != null) {
            if (!(stop > 0)) {
                errors.add(new ValidationError("stopPrice", "POSITIVE", "Stop price must be positive."));
            } else if (intent.getDirection() == TradeDirection.LONG && stop >= intent.getEntryPrice()) {
                errors.add(new ValidationError("stopPrice", "STOP_DIRECTION", "LONG stop must be below entry."));
            } else if (intent.getDirection() == TradeDirection.SHORT && stop <= intent.getEntryPrice()) {
                errors.add(new ValidationError("stopPrice", "STOP_DIRECTION", "SHORT stop must be above entry."));
            }
        }
        if (intent.getRiskPct() != null && (intent.getRiskPct() <= 0 || intent.getRiskPct() > MAX_RISK_PCT)) {
            errors.add(new ValidationError("riskPct", "RANGE", "Risk percent must be in (0, 0.10]."));
        }
        if (intent.getLeverage() != null && (intent.getLeverage() < 1 || intent.getLeverage() > MAX_LEVERAGE)) {
            errors.add(new ValidationError("leverage", "RANGE", "Leverage must be between 1 and 100."));
        }
        return errors;
    }

    public List<ValidationError> validateProposal(TradeProposal proposal) {
        List<ValidationError> errors = new ArrayList<>();
        TradeIntent intent = proposal.intent();
        if (proposal.governor() != null && !proposal.governor().allowed()) {
            errors.add(new ValidationError("governor", "GOVERNOR_BLOCKED",
                    "Risk governor blocked: " + String.join(", ", proposal.governor().reasonCodes())));
        }
        PositionSizingResult sizing = proposal.sizing();
        if (sizing != null && sizing.quantity() <= 0) {
            errors.add(new ValidationError("sizing", "ZERO_SIZE", "Computed position size is zero."));
        }
        ExitPlan exits = proposal.exits();
        if (exits != null) {
            double entry = intent.getEntryPrice();
            if (intent.getDirection() == TradeDirection.SHORT) {
                if (exits.stopPrice() <= entry) {
                    errors.add(new ValidationError("exits.stopPrice", "STOP_BELOW_ENTRY", "SHORT stop must be above entry."));
                }
                if (exits.takeProfit1() >= entry) {
                    errors.add(new ValidationError("exits.takeProfit1", "TP_ABOVE_ENTRY", "SHORT target must be below entry."));
                }
            } else {
                if (exits.stopPrice() >= entry) {
                    errors.add(new ValidationError("exits.stopPrice", "STOP_ABOVE_ENTRY", "LONG stop must be below entry."));
                }
                if (exits.takeProfit1() <= entry) {
                    errors.add(new ValidationError("exits.takeProfit1", "TP_BELOW_ENTRY", "LONG target must be above entry."));
                }
            }
        }
        if (sizing != null && sizing.accountEquity() > 0
                && sizing.notionalUsd() > sizing.accountEquity() * properties.getLimits().getHighNotionalPct()) {
            errors.add(new ValidationError("sizing.notionalUsd", "HIGH_NOTIONAL",
                    String.format("Notional $%.2f exceeds %.0f%% of equity.", sizing.notionalUsd(),
                            properties.getLimits().getHighNotionalPct() * 100)));
        }
        return errors;
    }
}
