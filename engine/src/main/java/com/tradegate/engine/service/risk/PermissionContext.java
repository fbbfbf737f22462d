package com.tradegate.engine.service.risk;

import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.DataHealthStatus;
import com.tradegate.engine.model.EventSeverity;
import com.tradegate.engine.model.MarketRegime;
import lombok.Builder;
import lombok.Value;

/**
 * Session state the permission snapshot is built from. Defaults are neutral: no realized loss,
 * no open risk, no loss streak.
 */
@Value
@Builder(toBuilder = true)
public class PermissionContext {
    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    MarketRegime regime = MarketRegime.RANGE_NEUTRAL;
    @Builder.Default
    DataHealthStatus dataStatus = DataHealthStatus.OK;
    @Builder.Default
    long dataAgeSeconds = 0;
    @Builder.Default
    EventSeverity eventSeverity = EventSeverity.NONE;
    /** Realized P&L today in R; losses are negative. */
    @Builder.Default
    double realizedDailyR = 0.0;
    @Builder.Default
    double openRiskR = 0.0;
    @Builder.Default
    int consecutiveLosses = 0;
    /** Halves the daily R budget. */
    boolean dailyBudgetHalved;
    @Builder.Default
    int tradesToday = 0;
    @Builder.Default
    AssetClass assetClass = AssetClass.EQUITY;
}
