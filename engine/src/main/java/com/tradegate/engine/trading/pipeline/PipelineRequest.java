package com.tradegate.engine.trading.pipeline;

import com.tradegate.engine.model.EventSeverity;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.service.risk.PermissionContext;
import lombok.Builder;
import lombok.Value;

/**
 * Loosely typed entry request. Regime, strategy source and asset class accept the aliases in
 * {@link IntentAliases}; optional numbers are {@code null} when absent.
 */
@Value
@Builder
public class PipelineRequest {
    String accountId;
    String symbol;
    String assetClass;
    TradeDirection direction;
    String regime;
    String strategySource;
    Double confidence;
    double entryPrice;
    Double atr;
    Double stopPrice;
    Double riskPct;
    Double leverage;
    @Builder.Default
    EventSeverity eventSeverity = EventSeverity.NONE;
    @Builder.Default
    boolean guardEnabled = true;
    /** Session state for the permission snapshot; derived from account P&L when {@code null}. */
    PermissionContext permissionContext;
}
