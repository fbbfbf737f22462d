package com.tradegate.engine.service.confluence;

import lombok.Builder;
import lombok.Value;

/**
 * Scanner and indicator context available before a full component set exists.
 * Every field is optional.
 */
@Value
@Builder
public class ConfluenceContext {
    Double scannerScore;
    Double rsi;
    Double adx;
    Double cci;
    Double volumeRatio;
    /** regular, premarket, afterhours or closed */
    String session;
    Integer alignedTimeframes;
    boolean derivativesAvailable;
    Double openInterestChange24h;
    Double fundingRate;
    Double fearGreed;
    Double ivRank;
}
