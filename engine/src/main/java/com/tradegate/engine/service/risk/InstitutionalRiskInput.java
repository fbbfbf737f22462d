package com.tradegate.engine.service.risk;

import com.tradegate.engine.model.AssetClass;
import com.tradegate.engine.model.TradeDirection;
import com.tradegate.engine.service.flow.FlowState;
import com.tradegate.engine.service.flow.TradeArchetype;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Inputs to the institutional governor. Risk figures are percent of equity, drawdown is in R.
 */
@Value
@Builder(toBuilder = true)
public class InstitutionalRiskInput {
    AssetClass assetClass;
    String symbol;
    FlowState flowState;
    TradeArchetype preferredArchetype;
    /** 0-100 */
    double conviction;
    /** 0-100 */
    double tps;
    double atrPercent;
    /** 0-100 */
    double expansionProbability;
    @Builder.Default
    ExpansionAcceleration expansionAcceleration = ExpansionAcceleration.FLAT;
    @Builder.Default
    AccountRisk account = AccountRisk.flat();
    @Singular
    List<CorrelationPosition> openPositions;
    CorrelationPosition proposedPosition;
    @Builder.Default
    BehaviorStats behavior = BehaviorStats.clean();
    VolatilityRegime volatilityOverride;
    /** Size multiplier from the flow permission layer; 1 when not supplied. */
    @Builder.Default
    double flowSizeMultiplier = 1.0;

    public record AccountRisk(double openRiskPercent, double proposedRiskPercent, double dailyRiskPercent, double dailyR) {

        public static AccountRisk flat() {
            return new AccountRisk(0, 0, 0, 0);
        }
    }

    /** Cluster is resolved from the symbol when {@code null}. */
    public record CorrelationPosition(String symbol, TradeDirection direction, String cluster) {
    }

    public record BehaviorStats(int consecutiveLosses, int lossesWindowMinutes, int tradesThisSession,
                                double expectancyR, int ruleViolations) {

        public static BehaviorStats clean() {
            return new BehaviorStats(0, Integer.MAX_VALUE, 0, 0, 0);
        }
    }
}
