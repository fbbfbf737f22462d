package com.tradegate.engine.service.flow;

import com.tradegate.engine.model.AssetClass;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
public class SessionOverlayService {

    private final SessionPhaseDetector sessionPhaseDetector;

    public SessionOverlay currentOverlay(AssetClass assetClass) {
        return overlayAt(assetClass, Instant.now());
    }

    public SessionOverlay overlayAt(AssetClass assetClass, Instant instant) {
        return overlayFor(sessionPhaseDetector.detect(assetClass, instant), assetClass);
    }

    /**
     * Rules for a phase. A phase that does not belong to the asset class gets the conservative default.
     */
    public SessionOverlay overlayFor(SessionPhase phase, AssetClass assetClass) {
        boolean crypto = assetClass != null && assetClass.isCrypto();
        SessionPhase effective = phase != null ? phase : SessionPhase.UNKNOWN;
        if (effective != SessionPhase.UNKNOWN && effective.isCrypto() != crypto) {
            return defaults(effective, crypto);
        }
        return switch (effective) {
            case OPENING_RANGE -> new SessionOverlay(effective, crypto, 5, 1.0, 1.0,
                    List.of("ORB (Opening Range Breakout)", "Trend continuation off gap", "Momentum entries off opening drive"),
                    List.of("Mean reversion / fading the open", "Counter-trend scalps in first 15 min"),
                    StopStyle.TIGHT_STRUCTURAL, 0, 0, 60, 1.0,
                    "OPENING_RANGE: ORB/trend-continuation window. Tighter stops, block mean reversion.", false);
            case MORNING_SESSION -> new SessionOverlay(effective, crypto, 0, 1.0, 1.0,
                    List.of(), List.of(), null, 0, 0, 65, 1.0,
                    "MORNING_SESSION: Full institutional flow. Standard permissions.", false);
            case MIDDAY -> new SessionOverlay(effective, crypto, -5, 0.70, 0.70,
                    List.of("Mean reversion to VWAP", "Range-bound scalps between support/resistance"),
                    List.of("Momentum continuation (midday breakouts frequently fail)",
                            "Aggressive breakout entries (wait for power hour)"),
                    null, 0, 0, 70, 1.3,
                    "MIDDAY: Low volume chop zone. Prefer mean reversion, block momentum.", true);
            case POWER_HOUR -> new SessionOverlay(effective, crypto, 0, 1.0, 1.0,
                    List.of("Momentum continuation into close", "Late-day breakouts with volume confirmation"),
                    List.of(), null, 0, 0, 65, 1.0,
                    "POWER_HOUR: Renewed institutional flow. Standard permissions.", false);
            case CLOSE_AUCTION -> new SessionOverlay(effective, crypto, -10, 0.50, 0.50,
                    List.of("Exit/trim existing positions"),
                    List.of("New entries without A+ confidence", "Breakout entries (gap risk overnight)",
                            "Mean reversion (closing auction sweep risk)"),
                    StopStyle.TIGHT_STRUCTURAL, 75, 70, 80, 1.15,
                    "CLOSE_AUCTION: Last minutes, tighten or block. Gap risk high.", true);
            case PRE_MARKET -> new SessionOverlay(effective, crypto, -8, 0.50, 0.50,
                    List.of("Limit orders only (ALLOW_TIGHTENED)", "Gap analysis prep entries"),
                    List.of("Market orders (slippage too high)", "Scalping (spreads too wide)", "Large position sizing"),
                    StopStyle.WIDER_CONFIRMATION, 60, 50, 75, 1.8,
                    "PRE_MARKET: Thin books, wide spreads. Limit orders only.", true);
            case AFTER_HOURS -> new SessionOverlay(effective, crypto, -12, 0.40, 0.35,
                    List.of("Limit orders only (ALLOW_TIGHTENED)", "Earnings reaction entries (if catalyst)"),
                    List.of("Market orders", "Scalping", "Large position sizing", "Counter-trend fades"),
                    StopStyle.WIDER_CONFIRMATION, 65, 55, 78, 2.5,
                    "AFTER_HOURS: Very thin liquidity. Minimal sizing.", true);
            case CRYPTO_US -> new SessionOverlay(effective, crypto, 3, 1.0, 1.0,
                    List.of("Momentum continuation in peak liquidity window", "Breakout entries with volume confirmation",
                            "Trend-following on funded pairs"),
                    List.of(), null, 0, 0, 60, 1.0,
                    "CRYPTO_US: NY overlap, peak crypto liquidity. Momentum permitted.", false);
            case CRYPTO_EUROPEAN -> new SessionOverlay(effective, crypto, 0, 0.90, 0.90,
                    List.of("Range breakout entries", "Early trend confirmation"),
                    List.of(), null, 0, 0, 65, 1.1,
                    "CRYPTO_EUROPEAN: Improving depth. Standard permissions.", false);
            case CRYPTO_ASIAN -> new SessionOverlay(effective, crypto, -3, 0.75, 0.75,
                    List.of("BTC/ETH pairs (liquid enough)", "Mean reversion setups"),
                    List.of("Low-cap alt breakouts (too thin)", "Aggressive momentum on illiquid pairs"),
                    null, 0, 50, 68, 1.2,
                    "CRYPTO_ASIAN: Moderate depth. Tighten risk units, avoid illiquid alts.", true);
            case CRYPTO_OVERNIGHT -> new SessionOverlay(effective, crypto, -8, 0.55, 0.55,
                    List.of("BTC/ETH limit orders only"),
                    List.of("Alt-coin entries (insufficient depth)", "Market orders on any pair", "Aggressive momentum plays"),
                    StopStyle.WIDER_CONFIRMATION, 55, 60, 75, 1.6,
                    "CRYPTO_OVERNIGHT: Thin window. Require higher liquidity clarity.", true);
            case UNKNOWN -> defaults(effective, crypto);
        };
    }

    private static SessionOverlay defaults(SessionPhase phase, boolean crypto) {
        return new SessionOverlay(phase, crypto, 0, 0.80, 0.80, List.of(), List.of(), null, 0, 0, 65, 1.2,
                "UNKNOWN session, applying conservative defaults.", false);
    }
}
