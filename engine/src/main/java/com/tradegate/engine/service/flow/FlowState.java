package com.tradegate.engine.service.flow;

/**
 * Institutional flow state. Each state carries its alignment score for every
 * {@link TradeArchetype}, in archetype declaration order.
 */
public enum FlowState {
    ACCUMULATION(0.2, 0.35, 0.1, 0.45, 1.0, 0.65, 0.55, 0.1),
    POSITIONING(0.65, 1.0, 0.3, 0.8, 0.35, 0.2, 0.25, 0.55),
    LAUNCH(1.0, 0.85, 0.65, 0.8, 0.2, 0.1, 0.2, 0.95),
    EXHAUSTION(0.25, 0.2, 0.1, 0.3, 0.75, 0.6, 1.0, 0.15),
    NEUTRAL(0.4, 0.4, 0.25, 0.45, 0.45, 0.35, 0.4, 0.35);

    private final double[] alignment;

    FlowState(double... alignment) {
        this.alignment = alignment;
    }

    public double alignment(TradeArchetype archetype) {
        return archetype == null ? 0.4 : alignment[archetype.ordinal()];
    }
}
