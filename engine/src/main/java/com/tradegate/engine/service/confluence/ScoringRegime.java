package com.tradegate.engine.service.confluence;

import com.tradegate.engine.model.MarketRegime;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import static com.tradegate.engine.service.confluence.ConfluenceComponent.FUNDAMENTAL_DERIVATIVES;
import static com.tradegate.engine.service.confluence.ConfluenceComponent.LIQUIDITY_LEVEL;
import static com.tradegate.engine.service.confluence.ConfluenceComponent.MULTI_TIMEFRAME;
import static com.tradegate.engine.service.confluence.ConfluenceComponent.SIGNAL_QUALITY;
import static com.tradegate.engine.service.confluence.ConfluenceComponent.TECHNICAL_ALIGNMENT;
import static com.tradegate.engine.service.confluence.ConfluenceComponent.VOLUME_ACTIVITY;

/**
 * Regime-calibrated weight matrix with minimum-value gates. Weights are listed in
 * SQ, TA, VA, LL, MTF, FD order and are not required to sum to exactly one.
 */
public enum ScoringRegime {
    TREND_EXPANSION(new double[]{0.20, 0.25, 0.15, 0.10, 0.20, 0.10},
            gates(TECHNICAL_ALIGNMENT, 50, MULTI_TIMEFRAME, 40)),
    TREND_MATURE(new double[]{0.15, 0.20, 0.20, 0.10, 0.15, 0.20},
            gates(VOLUME_ACTIVITY, 40, FUNDAMENTAL_DERIVATIVES, 35)),
    RANGE_COMPRESSION(new double[]{0.25, 0.15, 0.20, 0.15, 0.10, 0.15},
            gates(SIGNAL_QUALITY, 55, LIQUIDITY_LEVEL, 40)),
    VOL_EXPANSION(new double[]{0.15, 0.15, 0.10, 0.25, 0.10, 0.25},
            gates(LIQUIDITY_LEVEL, 50, FUNDAMENTAL_DERIVATIVES, 40)),
    TRANSITION(new double[]{0.20, 0.15, 0.15, 0.15, 0.20, 0.15},
            gates(MULTI_TIMEFRAME, 50, SIGNAL_QUALITY, 50));

    private final Map<ConfluenceComponent, Double> weights;
    private final Map<ConfluenceComponent, Double> gates;

    ScoringRegime(double[] weightVector, Map<ConfluenceComponent, Double> gates) {
        EnumMap<ConfluenceComponent, Double> w = new EnumMap<>(ConfluenceComponent.class);
        ConfluenceComponent[] components = ConfluenceComponent.values();
        for (int i = 0; i < components.length; i++) {
            w.put(components[i], weightVector[i]);
        }
        this.weights = Collections.unmodifiableMap(w);
        this.gates = Collections.unmodifiableMap(gates);
    }

    public Map<ConfluenceComponent, Double> weights() {
        return weights;
    }

    public Map<ConfluenceComponent, Double> gates() {
        return gates;
    }

    public static ScoringRegime fromMarketRegime(MarketRegime regime) {
        if (regime == null) {
            return TRANSITION;
        }
        return switch (regime) {
            case TREND_UP, TREND_DOWN -> TREND_EXPANSION;
            case RANGE_NEUTRAL, VOL_CONTRACTION -> RANGE_COMPRESSION;
            case VOL_EXPANSION, RISK_OFF_STRESS -> VOL_EXPANSION;
        };
    }

    /**
     * Resolves a free-text regime label. Unknown labels fall back to {@link #TRANSITION}.
     */
    public static ScoringRegime resolve(String label) {
        if (label == null || label.isBlank()) {
            return TRANSITION;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (ScoringRegime regime : values()) {
            if (regime.name().equals(normalized)) {
                return regime;
            }
        }
        for (MarketRegime regime : MarketRegime.values()) {
            if (regime.name().equals(normalized)) {
                return fromMarketRegime(regime);
            }
        }
        String lower = normalized.toLowerCase(Locale.ROOT);
        if (lower.contains("trend")) {
            return lower.contains("mature") || lower.contains("exhaust") ? TREND_MATURE : TREND_EXPANSION;
        }
        if (lower.contains("range") || lower.contains("compress") || lower.contains("neutral")) {
            return RANGE_COMPRESSION;
        }
        if (lower.contains("vol") || lower.contains("expan") || lower.contains("risk")) {
            return VOL_EXPANSION;
        }
        return TRANSITION;
    }

    private static Map<ConfluenceComponent, Double> gates(ConfluenceComponent first, double firstMin,
                                                          ConfluenceComponent second, double secondMin) {
        EnumMap<ConfluenceComponent, Double> gates = new EnumMap<>(ConfluenceComponent.class);
        gates.put(first, firstMin);
        gates.put(second, secondMin);
        return gates;
    }
}
