package com.tradegate.engine.trading.execution;

import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.StrategyTag;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.model.TradeIntent;
import com.tradegate.engine.util.DecimalUtils;
import org.springframework.stereotype.Service;

/**
 * Stop, targets, trail rule and time stop from ATR, asset class, regime and strategy.
 */
@Service
public class ExitPlanBuilder {

    private static final int PRICE_SCALE = 6;

    public ExitPlan build(TradeIntent intent) {
        return build(intent.getDirection(), intent.getEntryPrice(), intent.getAtr(), intent.getAssetClass(),
                intent.getRegime(), intent.getStrategyTag(), intent.getStopPrice());
    }

    public ExitPlan build(TradeDirection direction, double entryPrice, double atr, AssetClass assetClass,
                          MarketRegime regime, StrategyTag strategy, Double stopOverride) {
        int sign = direction == TradeDirection.SHORT ? -1 : 1;
        double stopDistance = atr * baseStopMultiple(assetClass) * regimeStopMultiple(regime) * strategyStopMultiple(strategy);
        double stop = stopOverride != null ? stopOverride : entryPrice - sign * stopDistance;
        double actualDistance = Math.abs(entryPrice - stop);

        double tp1Ratio = baseTp1Ratio(assetClass) * regimeTargetMultiple(regime);
        double tp2Ratio = baseTp2Ratio(assetClass);
        double tp1 = entryPrice + sign * actualDistance * tp1Ratio;
        double tp2 = entryPrice + sign * actualDistance * tp2Ratio;

        return new ExitPlan(
                DecimalUtils.round(stop, PRICE_SCALE),
                DecimalUtils.round(tp1, PRICE_SCALE),
                DecimalUtils.round(tp2, PRICE_SCALE),
                trailRule(regime, strategy),
                timeStopMinutes(assetClass, strategy),
                DecimalUtils.round2(tp1Ratio),
                DecimalUtils.round2(tp2Ratio)
        );
    }

    static double baseStopMultiple(AssetClass assetClass) {
        if (assetClass == null) {
            return 1.5;
        }
        return switch (assetClass) {
            case CRYPTO -> 2.0;
            case FOREX -> 1.0;
            case EQUITY, FUTURES, OPTIONS -> 1.5;
        };
    }

    static double baseTp1Ratio(AssetClass assetClass) {
        if (assetClass == null) {
            return 2.0;
        }
        return switch (assetClass) {
            case CRYPTO -> 2.5;
            case FOREX -> 1.5;
            case EQUITY, FUTURES, OPTIONS -> 2.0;
        };
    }

    static double baseTp2Ratio(AssetClass assetClass) {
        if (assetClass == null) {
            return 4.0;
        }
        return switch (assetClass) {
            case EQUITY -> 4.0;
            case CRYPTO -> 5.0;
            case FUTURES -> 3.5;
            case FOREX, OPTIONS -> 3.0;
        };
    }

    private static double regimeStopMultiple(MarketRegime regime) {
        if (regime == null) {
            return 1.0;
        }
        return switch (regime) {
            case VOL_EXPANSION, RISK_OFF_STRESS -> 1.3;
            case VOL_CONTRACTION -> 0.8;
            case TREND_UP, TREND_DOWN, RANGE_NEUTRAL -> 1.0;
        };
    }

    private static double regimeTargetMultiple(MarketRegime regime) {
        if (regime == null) {
            return 1.0;
        }
        return switch (regime) {
            case TREND_UP, TREND_DOWN -> 1.2;
            case RANGE_NEUTRAL -> 0.85;
            case VOL_EXPANSION, VOL_CONTRACTION, RISK_OFF_STRESS -> 1.0;
        };
    }

    private static double strategyStopMultiple(StrategyTag strategy) {
        if (strategy == null) {
            return 1.0;
        }
        return switch (strategy) {
            case MEAN_REVERSION -> 0.75;
            case BREAKOUT_CONTINUATION -> 1.15;
            case EVENT_STRATEGY -> 1.4;
            case TREND_PULLBACK, RANGE_FADE, MOMENTUM_REVERSAL -> 1.0;
        };
    }

    private static TrailRule trailRule(MarketRegime regime, StrategyTag strategy) {
        if (regime != null && regime.isTrending()) {
            return TrailRule.CHANDELIER;
        }
        if (regime != null && regime.isStressed()) {
            return TrailRule.ATR_2X;
        }
        if (strategy == StrategyTag.BREAKOUT_CONTINUATION) {
            return TrailRule.ATR_1_5X;
        }
        if (strategy == StrategyTag.MEAN_REVERSION || strategy == StrategyTag.RANGE_FADE) {
            return TrailRule.BREAKEVEN_AFTER_1R;
        }
        return TrailRule.ATR_1X;
    }

    private static int timeStopMinutes(AssetClass assetClass, StrategyTag strategy) {
        if (strategy == StrategyTag.EVENT_STRATEGY) {
            return 60;
        }
        if (assetClass == AssetClass.CRYPTO) {
            return 24 * 60;
        }
        if (assetClass == AssetClass.FOREX) {
            return 8 * 60;
        }
        // regular US session is 6.5h
        return strategy == StrategyTag.MEAN_REVERSION ? 4 * 60 : 390;
    }
}
