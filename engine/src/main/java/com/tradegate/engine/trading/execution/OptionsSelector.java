package com.tradegate.engine.trading.execution;

import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.OptionsStructure;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.model.TradeIntent;
import com.tradegate.engine.util.DecimalUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Chooses an options structure, tenor and delta. Premium is a rough volatility-scaled estimate, not a pricing model.
 */
@Service
public class OptionsSelector {

    private static final double CONTRACT_MULTIPLIER = 100.0;
    private static final double STRESSED_IV = 0.45;
    private static final double BASE_IV = 0.25;

    public OptionsSelection select(TradeIntent intent, double riskBudgetUsd) {
        MarketRegime regime = intent.getRegime() == null ? MarketRegime.RANGE_NEUTRAL : intent.getRegime();
        double confidence = intent.getConfidence();
        List<String> notes = new ArrayList<>();

        OptionsStructure structure = intent.getOptionsStructure() != null && intent.getOptionsStructure() != OptionsStructure.NONE
                ? intent.getOptionsStructure()
                : chooseStructure(regime, intent.getDirection(), confidence, notes);
        int dte = intent.getOptionsDte() != null && intent.getOptionsDte() > 0 ? intent.getOptionsDte() : defaultDte(regime);
        double delta = intent.getOptionsDelta() != null && intent.getOptionsDelta() > 0 ? intent.getOptionsDelta() : defaultDelta(confidence);

        double entry = intent.getEntryPrice();
        double iv = regime.isStressed() ? STRESSED_IV : BASE_IV;
        double premium = DecimalUtils.round2(entry * delta * Math.sqrt(dte / 365.0) * iv);
        double perContract = premium * CONTRACT_MULTIPLIER * (structure.isTwoLegVolatility() ? 2 : 1);
        double maxLoss = Math.min(Math.max(0, riskBudgetUsd), perContract);

        notes.add(String.format("%d DTE from %s table", dte, regime));
        notes.add(String.format("%.2f delta for confidence %.0f", delta, confidence));
        if (structure.isDebitSpread() || structure == OptionsStructure.IRON_CONDOR) {
            notes.add("Defined risk, max loss limited to the debit paid");
        }
        if (perContract > riskBudgetUsd) {
            notes.add(String.format("Single contract $%.2f exceeds risk budget $%.2f", perContract, riskBudgetUsd));
        }

        return new OptionsSelection(structure, dte, DecimalUtils.round2(delta), entry, premium,
                DecimalUtils.round2(perContract), DecimalUtils.round2(maxLoss), List.copyOf(notes));
    }

    private static OptionsStructure chooseStructure(MarketRegime regime, TradeDirection direction,
                                                    double confidence, List<String> notes) {
        boolean bullish = direction != TradeDirection.SHORT;
        if (regime.isStressed()) {
            notes.add("Elevated volatility, defined-risk spread");
            return bullish ? OptionsStructure.CALL_DEBIT_SPREAD : OptionsStructure.PUT_DEBIT_SPREAD;
        }
        if (regime == MarketRegime.RANGE_NEUTRAL && confidence < 65) {
            notes.add("Range with low conviction, premium collection");
            return OptionsStructure.IRON_CONDOR;
        }
        if (regime == MarketRegime.VOL_CONTRACTION && confidence >= 70) {
            notes.add("Compressed volatility, long straddle for expansion");
            return OptionsStructure.STRADDLE;
        }
        return bullish ? OptionsStructure.LONG_CALL : OptionsStructure.LONG_PUT;
    }

    static int defaultDte(MarketRegime regime) {
        return switch (regime) {
            case TREND_UP, TREND_DOWN -> 30;
            case RANGE_NEUTRAL -> 14;
            case VOL_EXPANSION -> 21;
            case VOL_CONTRACTION -> 45;
            case RISK_OFF_STRESS -> 7;
        };
    }

    static double defaultDelta(double confidence) {
        if (confidence >= 80) {
            return 0.70;
        }
        if (confidence >= 65) {
            return 0.55;
        }
        return confidence >= 50 ? 0.45 : 0.30;
    }
}
