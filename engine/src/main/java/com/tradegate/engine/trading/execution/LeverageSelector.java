package com.tradegate.engine.trading.execution;

import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.RiskMode;
import com.tradegate.engine.util.DecimalUtils;
import org.springframework.stereotype.Service;

/**
 * Recommended leverage = hard cap x regime fraction x risk-mode fraction x volatility scalar, never below 1x.
 */
@Service
public class LeverageSelector {

    public LeverageResult select(AssetClass assetClass, MarketRegime regime, RiskMode riskMode,
                                 double atrPercent, Double override) {
        double cap = hardCap(assetClass);
        if (cap <= 1) {
            return new LeverageResult(1, 1, false, false, null);
        }

        double raw = cap * regimeFraction(regime) * riskModeFraction(riskMode) * volatilityScalar(atrPercent);
        double recommended = Math.max(1.0, DecimalUtils.round2(raw));

        if (override == null || override <= 0) {
            return new LeverageResult(cap, recommended, false, false, null);
        }
        if (override > cap) {
            return new LeverageResult(cap, cap, true, false,
                    String.format("Override %sx exceeds %s cap %sx.", format(override), assetClass, format(cap)));
        }
        double effective = Math.max(1.0, override);
        if (effective > recommended * 1.5) {
            return new LeverageResult(cap, effective, false, true,
                    String.format("Override %sx is above recommended %sx, elevated risk.", format(effective), format(recommended)));
        }
        return new LeverageResult(cap, effective, false, false, null);
    }

    static double hardCap(AssetClass assetClass) {
        if (assetClass == null) {
            return 1;
        }
        return switch (assetClass) {
            case EQUITY -> 4;
            case CRYPTO -> 20;
            case FUTURES, FOREX -> 50;
            case OPTIONS -> 1;
        };
    }

    private static double regimeFraction(MarketRegime regime) {
        if (regime == null) {
            return 0.5;
        }
        return switch (regime) {
            case TREND_UP, TREND_DOWN -> 0.75;
            case RANGE_NEUTRAL -> 0.50;
            case VOL_CONTRACTION -> 0.60;
            case VOL_EXPANSION -> 0.35;
            case RISK_OFF_STRESS -> 0.20;
        };
    }

    private static double riskModeFraction(RiskMode mode) {
        if (mode == null) {
            return 0.5;
        }
        return switch (mode) {
            case NORMAL -> 1.0;
            case THROTTLED -> 0.60;
            case DEFENSIVE -> 0.30;
            case LOCKED -> 0.0;
        };
    }

    private static double volatilityScalar(double atrPercent) {
        if (atrPercent >= 8) {
            return 0.15;
        }
        if (atrPercent >= 5) {
            return 0.30;
        }
        if (atrPercent >= 3) {
            return 0.50;
        }
        return atrPercent >= 1.5 ? 0.75 : 1.0;
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(DecimalUtils.round2(value));
    }
}
