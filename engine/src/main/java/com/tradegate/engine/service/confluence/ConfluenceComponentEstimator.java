package com.tradegate.engine.service.confluence;

import com.tradegate.engine.util.DecimalUtils;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Derives confluence components from scanner and indicator readings. Missing readings
 * leave a component at its neutral starting value.
 */
@Service
public class ConfluenceComponentEstimator {

    public ConfluenceComponents estimate(ConfluenceContext context) {
        if (context == null) {
            return ConfluenceComponents.neutral();
        }
        return new ConfluenceComponents(
                signalQuality(context),
                technicalAlignment(context),
                volumeActivity(context),
                liquidityLevel(context.getSession()),
                multiTimeframe(context),
                fundamentalDerivatives(context)
        ).clamped();
    }

    private double signalQuality(ConfluenceContext context) {
        return context.getScannerScore() != null ? context.getScannerScore() : 50.0;
    }

    private double technicalAlignment(ConfluenceContext context) {
        double score = 50.0;
        Double rsi = context.getRsi();
        if (rsi != null) {
            if (rsi > 50 && rsi < 70) {
                score += 15;
            } else if (rsi > 30 && rsi < 50) {
                score -= 10;
            } else if (rsi >= 70 || rsi <= 30) {
                score -= 5;
            }
        }
        Double adx = context.getAdx();
        if (adx != null) {
            if (adx > 25) {
                score += 10;
            } else if (adx < 15) {
                score -= 10;
            }
        }
        Double cci = context.getCci();
        if (cci != null) {
            if (cci > 0) {
                score += 5;
            } else if (cci < -100) {
                score -= 10;
            }
        }
        return score;
    }

    private double volumeActivity(ConfluenceContext context) {
        double score = 50.0;
        Double ratio = context.getVolumeRatio();
        if (ratio != null) {
            if (ratio > 1.5) {
                score += 20;
            } else if (ratio > 1.0) {
                score += 10;
            } else if (ratio < 0.6) {
                score -= 15;
            }
        }
        return score;
    }

    private double liquidityLevel(String session) {
        if (session == null) {
            return 60.0;
        }
        return switch (session.trim().toLowerCase(Locale.ROOT)) {
            case "regular" -> 70.0;
            case "premarket", "afterhours" -> 40.0;
            case "closed" -> 20.0;
            default -> 60.0;
        };
    }

    private double multiTimeframe(ConfluenceContext context) {
        int aligned = context.getAlignedTimeframes() != null ? context.getAlignedTimeframes() : 2;
        return aligned * 20.0;
    }

    private double fundamentalDerivatives(ConfluenceContext context) {
        double score = 45.0;
        if (context.isDerivativesAvailable()) {
            score = 55.0;
            if (context.getOpenInterestChange24h() != null && Math.abs(context.getOpenInterestChange24h()) > 5) {
                score += 10;
            }
            if (context.getFundingRate() != null && Math.abs(context.getFundingRate()) > 0.05) {
                score += 5;
            }
            Double fearGreed = context.getFearGreed();
            if (fearGreed != null && (fearGreed < 25 || fearGreed > 75)) {
                score += 10;
            }
        }
        Double ivRank = context.getIvRank();
        if (ivRank != null && (ivRank > 70 || ivRank < 30)) {
            score += 5;
        }
        return DecimalUtils.clampScore(score);
    }
}
