package com.tradegate.engine.service.flow;

import lombok.Builder;
import lombok.Value;

/**
 * Scores are on a 0-100 scale.
 */
@Value
@Builder
public class FlowPermissionInput {
    FlowState state;
    double stateConfidence;
    double institutionalProbability;
    double dataHealthScore;
    double liquidityClarity;
    double volatilityCompression;
    double atrExpansionRate;
    TradeArchetype preferredArchetype;
    SessionOverlay sessionOverlay;
}
