package com.tradegate.engine.service.confluence;

public enum ConfluenceComponent {
    SIGNAL_QUALITY("SQ"),
    TECHNICAL_ALIGNMENT("TA"),
    VOLUME_ACTIVITY("VA"),
    LIQUIDITY_LEVEL("LL"),
    MULTI_TIMEFRAME("MTF"),
    FUNDAMENTAL_DERIVATIVES("FD");

    private final String code;

    ConfluenceComponent(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
