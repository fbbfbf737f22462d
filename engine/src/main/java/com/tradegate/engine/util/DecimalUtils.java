package com.tradegate.engine.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class DecimalUtils {

    public static final double NEUTRAL_SCORE = 50.0;

    private DecimalUtils() {
    }

    public static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static double round1(double value) {
        return round(value, 1);
    }

    public static double round2(double value) {
        return round(value, 2);
    }

    public static double floor(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.FLOOR).doubleValue();
    }

    /**
     * Bounds {@code value} to {@code [min, max]}. NaN maps to {@code min}.
     */
    public static double clamp(double value, double min, double max) {
        return clamp(value, min, max, min);
    }

    /**
     * Bounds {@code value} to {@code [min, max]}, substituting {@code fallback} for NaN or infinite input.
     */
    public static double clamp(double value, double min, double max, double fallback) {
        if (!Double.isFinite(value)) {
            return fallback;
        }
        return Math.max(min, Math.min(max, value));
    }

    /** Unit interval; non-finite input counts as zero. */
    public static double clamp01(double value) {
        return clamp(value, 0.0, 1.0, 0.0);
    }

    /** 0-100 score; non-finite input counts as the neutral midpoint. */
    public static double clampScore(double value) {
        return clamp(value, 0.0, 100.0, NEUTRAL_SCORE);
    }

    public static String pct(double fraction, int scale) {
        return BigDecimal.valueOf(fraction * 100).setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }
}
