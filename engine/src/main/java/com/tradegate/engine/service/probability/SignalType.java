package com.tradegate.engine.service.probability;

/**
 * Historical base win rate and relative weight of each signal when it fires.
 */
public enum SignalType {
    UNUSUAL_ACTIVITY("Unusual Activity", 0.65, 0.25, SignalCluster.VOLUME_FLOW),
    PUT_CALL_RATIO("Put/Call Ratio", 0.58, 0.15, SignalCluster.VOLUME_FLOW),
    MAX_PAIN_DISTANCE("Max Pain Gravity", 0.55, 0.10, SignalCluster.INDEPENDENT),
    TIME_CONFLUENCE("Time Confluence", 0.62, 0.20, SignalCluster.TREND_MOMENTUM),
    IV_RANK("IV Environment", 0.60, 0.10, SignalCluster.INDEPENDENT),
    TREND_ALIGNMENT("Trend Alignment", 0.58, 0.10, SignalCluster.TREND_MOMENTUM),
    RSI_MOMENTUM("RSI Momentum", 0.55, 0.05, SignalCluster.TREND_MOMENTUM),
    VOLUME_CONFIRMATION("Volume Confirmation", 0.54, 0.05, SignalCluster.VOLUME_FLOW);

    private final String displayName;
    private final double baseWinRate;
    private final double weight;
    private final SignalCluster cluster;

    SignalType(String displayName, double baseWinRate, double weight, SignalCluster cluster) {
        this.displayName = displayName;
        this.baseWinRate = baseWinRate;
        this.weight = weight;
        this.cluster = cluster;
    }

    public String displayName() {
        return displayName;
    }

    public double baseWinRate() {
        return baseWinRate;
    }

    public double weight() {
        return weight;
    }

    public SignalCluster cluster() {
        return cluster;
    }

    /** Base edge expressed in log-odds. */
    public double baseLogOdds() {
        return Math.log(baseWinRate / (1.0 - baseWinRate));
    }
}
