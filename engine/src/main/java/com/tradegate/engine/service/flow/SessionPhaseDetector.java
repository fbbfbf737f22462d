package com.tradegate.engine.service.flow;

import com.tradegate.engine.config.RiskProperties;
import com.tradegate.engine.model.AssetClass;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Tags an instant with its trading session. Equity sessions follow the configured market
 * zone, so daylight saving is handled; crypto sessions are fixed UTC blocks.
 */
@Service
@RequiredArgsConstructor
public class SessionPhaseDetector {

    private static final LocalTime OPEN = LocalTime.of(9, 30);
    private static final LocalTime OPENING_RANGE_END = LocalTime.of(10, 0);
    private static final LocalTime MORNING_END = LocalTime.of(11, 30);
    private static final LocalTime MIDDAY_END = LocalTime.of(14, 0);
    private static final LocalTime POWER_HOUR_END = LocalTime.of(15, 50);
    private static final LocalTime CLOSE = LocalTime.of(16, 0);

    private final RiskProperties riskProperties;

    public SessionPhase detect(AssetClass assetClass, Instant instant) {
        if (instant == null) {
            return SessionPhase.UNKNOWN;
        }
        if (assetClass != null && assetClass.isCrypto()) {
            int hour = instant.atZone(ZoneOffset.UTC).getHour();
            if (hour < 8) {
                return SessionPhase.CRYPTO_ASIAN;
            }
            if (hour < 14) {
                return SessionPhase.CRYPTO_EUROPEAN;
            }
            return hour < 22 ? SessionPhase.CRYPTO_US : SessionPhase.CRYPTO_OVERNIGHT;
        }

        LocalTime time = instant.atZone(ZoneId.of(riskProperties.getFlow().getMarketZone())).toLocalTime();
        if (time.isBefore(OPEN)) {
            return SessionPhase.PRE_MARKET;
        }
        if (time.isBefore(OPENING_RANGE_END)) {
            return SessionPhase.OPENING_RANGE;
        }
        if (time.isBefore(MORNING_END)) {
            return SessionPhase.MORNING_SESSION;
        }
        if (time.isBefore(MIDDAY_END)) {
            return SessionPhase.MIDDAY;
        }
        if (time.isBefore(POWER_HOUR_END)) {
            return SessionPhase.POWER_HOUR;
        }
        return time.isBefore(CLOSE) ? SessionPhase.CLOSE_AUCTION : SessionPhase.AFTER_HOURS;
    }
}
