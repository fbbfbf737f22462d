package com.tradegate.engine.trading.execution;

public record ValidationError(String field, String code, String message) {

    /** Advisory codes are reported but do not make a proposal non-executable. */
    public boolean isBlocking() {
        return !"HIGH_NOTIONAL".equals(code);
    }
}
