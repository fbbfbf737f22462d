package com.tradegate.engine.service.confluence;

import com.tradegate.engine.util.DecimalUtils;

/**
 * Six 0-100 sub-scores feeding the confluence score.
 */
public record ConfluenceComponents(
        double signalQuality,
        double technicalAlignment,
        double volumeActivity,
        double liquidityLevel,
        double multiTimeframe,
        double fundamentalDerivatives
) {

    public ConfluenceComponents clamped() {
        return new ConfluenceComponents(
                DecimalUtils.clampScore(signalQuality),
                DecimalUtils.clampScore(technicalAlignment),
                DecimalUtils.clampScore(volumeActivity),
                DecimalUtils.clampScore(liquidityLevel),
                DecimalUtils.clampScore(multiTimeframe),
                DecimalUtils.clampScore(fundamentalDerivatives)
        );
    }

    public double value(ConfluenceComponent component) {
        return switch (component) {
            case SIGNAL_QUALITY -> signalQuality;
            case TECHNICAL_ALIGNMENT -> technicalAlignment;
            case VOLUME_ACTIVITY -> volumeActivity;
            case LIQUIDITY_LEVEL -> liquidityLevel;
            case MULTI_TIMEFRAME -> multiTimeframe;
            case FUNDAMENTAL_DERIVATIVES -> fundamentalDerivatives;
        };
    }

    /** All components at the neutral midpoint. */
    public static ConfluenceComponents neutral() {
        return new ConfluenceComponents(50, 50, 50, 50, 50, 50);
    }
}
