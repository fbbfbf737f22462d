package com.tradegate.engine.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A proposed trade as submitted for gating. Optional fields are {@code null} when the caller
 * leaves the decision to the engine.
 */
@Value
@Builder(toBuilder = true)
public class TradeIntent {
    String symbol;
    AssetClass assetClass;
    TradeDirection direction;
    StrategyTag strategyTag;
    /** 0-100 */
    double confidence;
    MarketRegime regime;
    double entryPrice;
    double atr;
    Double stopPrice;
    @Builder.Default
    EventSeverity eventSeverity = EventSeverity.NONE;
    Integer optionsDte;
    Double optionsDelta;
    OptionsStructure optionsStructure;
    Double accountEquity;
    Double riskPct;
    Double leverage;
    @Singular
    List<OpenPosition> openPositions;
}
