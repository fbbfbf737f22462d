package com.tradegate.engine.model;

public enum OptionsStructure {
    NONE,
    LONG_CALL,
    LONG_PUT,
    CALL_DEBIT_SPREAD,
    PUT_DEBIT_SPREAD,
    IRON_CONDOR,
    STRADDLE,
    STRANGLE;

    public boolean isDebitSpread() {
        return this == CALL_DEBIT_SPREAD || this == PUT_DEBIT_SPREAD;
    }

    public boolean isTwoLegVolatility() {
        return this == STRADDLE || this == STRANGLE;
    }
}
