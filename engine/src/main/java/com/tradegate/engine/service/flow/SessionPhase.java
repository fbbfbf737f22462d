package com.tradegate.engine.service.flow;

public enum SessionPhase {
    PRE_MARKET,
    OPENING_RANGE,
    MORNING_SESSION,
    MIDDAY,
    POWER_HOUR,
    CLOSE_AUCTION,
    AFTER_HOURS,
    CRYPTO_ASIAN,
    CRYPTO_EUROPEAN,
    CRYPTO_US,
    CRYPTO_OVERNIGHT,
    UNKNOWN;

    public boolean isCrypto() {
        return name().startsWith("CRYPTO_");
    }
}
