package com.tradegate.engine.service.probability;

/**
 * Correlation clusters. Signals in the same cluster pointing the same way share information,
 * so each additional one is damped.
 */
public enum SignalCluster {
    TREND_MOMENTUM(1.0, 0.75, 0.6),
    VOLUME_FLOW(1.0, 0.9, 0.8),
    INDEPENDENT(1.0, 1.0, 1.0);

    private final double first;
    private final double second;
    private final double rest;

    SignalCluster(double first, double second, double rest) {
        this.first = first;
        this.second = second;
        this.rest = rest;
    }

    /** Damping for the n-th (0-based) same-direction signal in this cluster. */
    public double damping(int index) {
        if (index <= 0) {
            return first;
        }
        return index == 1 ? second : rest;
    }
}
