package com.tradegate.engine.service.risk;

import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.model.Permission;
import com.tradegate.engine.model.StrategyTag;
import com.tradegate.engine.model.TradeDirection;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.tradegate.engine.model.Permission.ALLOW;
import static com.tradegate.engine.model.Permission.ALLOW_REDUCED;
import static com.tradegate.engine.model.Permission.ALLOW_TIGHTENED;
import static com.tradegate.engine.model.Permission.BLOCK;

/**
 * Strategy x direction permissions per market regime.
 */
public final class PermissionMatrix {

    private PermissionMatrix() {
    }

    /**
     * Matrix for {@code regime}; an unknown (null) regime is treated as {@link MarketRegime#RANGE_NEUTRAL}.
     */
    public static Map<StrategyTag, Map<TradeDirection, Permission>> forRegime(MarketRegime regime) {
        MarketRegime effective = regime != null ? regime : MarketRegime.RANGE_NEUTRAL;
        Map<StrategyTag, Map<TradeDirection, Permission>> matrix = new EnumMap<>(StrategyTag.class);
        for (StrategyTag strategy : StrategyTag.values()) {
            matrix.put(strategy, cell(effective, strategy));
        }
        return Collections.unmodifiableMap(matrix);
    }

    public static Map<StrategyTag, Map<TradeDirection, Permission>> allowAll() {
        Map<StrategyTag, Map<TradeDirection, Permission>> matrix = new EnumMap<>(StrategyTag.class);
        for (StrategyTag strategy : StrategyTag.values()) {
            matrix.put(strategy, pair(ALLOW, ALLOW));
        }
        return Collections.unmodifiableMap(matrix);
    }

    private static Map<TradeDirection, Permission> cell(MarketRegime regime, StrategyTag strategy) {
        return switch (regime) {
            case TREND_UP -> switch (strategy) {
                case BREAKOUT_CONTINUATION, TREND_PULLBACK -> pair(ALLOW, BLOCK);
                case RANGE_FADE, MOMENTUM_REVERSAL -> pair(BLOCK, BLOCK);
                case MEAN_REVERSION -> pair(ALLOW_REDUCED, BLOCK);
                case EVENT_STRATEGY -> pair(ALLOW_REDUCED, ALLOW_REDUCED);
            };
            case TREND_DOWN -> switch (strategy) {
                case BREAKOUT_CONTINUATION, TREND_PULLBACK -> pair(BLOCK, ALLOW_REDUCED);
                case RANGE_FADE, MOMENTUM_REVERSAL -> pair(BLOCK, BLOCK);
                case MEAN_REVERSION, EVENT_STRATEGY -> pair(ALLOW_REDUCED, ALLOW_REDUCED);
            };
            case RANGE_NEUTRAL -> switch (strategy) {
                case BREAKOUT_CONTINUATION, TREND_PULLBACK, MOMENTUM_REVERSAL -> pair(ALLOW_TIGHTENED, ALLOW_TIGHTENED);
                case RANGE_FADE, MEAN_REVERSION -> pair(ALLOW, ALLOW);
                case EVENT_STRATEGY -> pair(ALLOW_REDUCED, ALLOW_REDUCED);
            };
            case VOL_EXPANSION -> switch (strategy) {
                case BREAKOUT_CONTINUATION, TREND_PULLBACK, RANGE_FADE, EVENT_STRATEGY -> pair(ALLOW_REDUCED, ALLOW_REDUCED);
                case MEAN_REVERSION -> pair(ALLOW_TIGHTENED, ALLOW_TIGHTENED);
                case MOMENTUM_REVERSAL -> pair(BLOCK, BLOCK);
            };
            case VOL_CONTRACTION -> switch (strategy) {
                case BREAKOUT_CONTINUATION, TREND_PULLBACK -> pair(ALLOW_TIGHTENED, ALLOW_TIGHTENED);
                case RANGE_FADE, MEAN_REVERSION -> pair(ALLOW, ALLOW);
                case MOMENTUM_REVERSAL -> pair(BLOCK, BLOCK);
                case EVENT_STRATEGY -> pair(ALLOW_REDUCED, ALLOW_REDUCED);
            };
            case RISK_OFF_STRESS -> switch (strategy) {
                case BREAKOUT_CONTINUATION, MOMENTUM_REVERSAL -> pair(BLOCK, BLOCK);
                case TREND_PULLBACK -> pair(BLOCK, ALLOW_REDUCED);
                case RANGE_FADE, MEAN_REVERSION, EVENT_STRATEGY -> pair(ALLOW_REDUCED, ALLOW_REDUCED);
            };
        };
    }

    private static Map<TradeDirection, Permission> pair(Permission longSide, Permission shortSide) {
        Map<TradeDirection, Permission> cell = new EnumMap<>(TradeDirection.class);
        cell.put(TradeDirection.LONG, longSide);
        cell.put(TradeDirection.SHORT, shortSide);
        return Collections.unmodifiableMap(cell);
    }
}
