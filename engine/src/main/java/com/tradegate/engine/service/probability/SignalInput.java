package com.tradegate.engine.service.probability;

import lombok.Builder;
import lombok.Value;

/**
 * One signal reading. Only the fields relevant to the signal's type are read; the rest stay {@code null}.
 */
@Value
@Builder(toBuilder = true)
public class SignalInput {
    boolean triggered;
    /** 0-1 */
    double confidence;

    Double callPremium;
    Double putPremium;
    String alertLevel;

    Double putCallRatio;

    Double maxPain;
    Double currentPrice;

    Integer timeframeStack;

    Double ivRank;

    /** TRUE above the 200 EMA, FALSE below, null when near it. */
    Boolean aboveEma200;

    Double rsi;

    public static SignalInput fired(double confidence) {
        return SignalInput.builder().triggered(true).confidence(confidence).build();
    }
}
