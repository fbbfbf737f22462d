package com.tradegate.engine.service.risk;

import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.EventSeverity;
import com.tradegate.engine.model.OpenPosition;
import com.tradegate.engine.model.StrategyTag;
import com.tradegate.engine.model.TradeDirection;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CandidateIntent {
    String symbol;
    AssetClass assetClass;
    StrategyTag strategyTag;
    TradeDirection direction;
    double confidence;
    double entryPrice;
    double stopPrice;
    double atr;
    @Builder.Default
    EventSeverity eventSeverity = EventSeverity.NONE;
    @Singular
    List<OpenPosition> openPositions;
    /** Equity used for the max position size; {@code null} falls back to the configured default. */
    Double accountEquity;
}
