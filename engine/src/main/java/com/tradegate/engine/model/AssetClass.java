package com.tradegate.engine.model;

import java.util.Locale;

public enum AssetClass {
    EQUITY,
    CRYPTO,
    FUTURES,
    FOREX,
    OPTIONS;

    public boolean isCrypto() {
        return this == CRYPTO;
    }

    /**
     * Lenient parse used at the pipeline boundary. Commodities trade through the equity rules.
     */
    public static AssetClass fromString(String value) {
        if (value == null || value.isBlank()) {
            return EQUITY;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "CRYPTO" -> CRYPTO;
            case "FUTURES" -> FUTURES;
            case "FOREX", "FX" -> FOREX;
            case "OPTIONS", "OPTION" -> OPTIONS;
            default -> EQUITY;
        };
    }
}
