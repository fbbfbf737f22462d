package com.tradegate.engine.service.probability;

import com.tradegate.engine.config.ExecutionProperties;
import com.tradegate.engine.util.DecimalUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines signal evidence in log-odds space, starting from a coin-flip prior, and gates
 * Kelly sizing on signal count, probability and edge over break-even.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProbabilityEngine {

    static final double PRIOR = 0.5;
    static final double MAX_SIGNAL_LOG_ODDS = 0.6;
    static final double CONFLUENCE_BOOST = 0.15;
    static final double MIN_PROBABILITY = 0.35;
    static final double MAX_PROBABILITY = 0.80;

    static final int KELLY_MIN_ALIGNED = 3;
    static final double KELLY_MIN_PROBABILITY = 0.55;
    static final double KELLY_EDGE_BUFFER = 0.05;
    static final double KELLY_CAP_OPTIONS = 0.10;
    static final double KELLY_CAP_DEFAULT = 0.25;

    private final ExecutionProperties executionProperties;

    public ProbabilityResult evaluate(TradeSignals signals, SignalBias requested, double rewardRisk, boolean options) {
        TradeSignals input = signals != null ? signals : TradeSignals.none();
        double b = rewardRisk > 0 ? rewardRisk : 2.0;

        Map<SignalType, SignalBias> biases = new EnumMap<>(SignalType.class);
        int bullish = 0;
        int bearish = 0;
        for (SignalType type : SignalType.values()) {
            SignalInput signal = input.get(type);
            if (signal == null || !signal.isTriggered()) {
                continue;
            }
            SignalBias bias = biasOf(type, signal, requested);
            biases.put(type, bias);
            if (bias == SignalBias.BULLISH) {
                bullish++;
            } else if (bias == SignalBias.BEARISH) {
                bearish++;
            }
        }
        SignalBias dominant = bullish > bearish ? SignalBias.BULLISH
                : bearish > bullish ? SignalBias.BEARISH
                : SignalBias.NEUTRAL;
        SignalBias direction = requested == null || requested == SignalBias.NEUTRAL ? dominant : requested;

        List<Evidence> evidence = new ArrayList<>();
        for (Map.Entry<SignalType, SignalBias> entry : biases.entrySet()) {
            SignalType type = entry.getKey();
            SignalInput signal = input.get(type);
            int sign = entry.getValue().signRelativeTo(direction);
            double confidence = DecimalUtils.clamp01(signal.getConfidence());
            evidence.add(new Evidence(type, entry.getValue(), sign, confidence, sign * type.baseLogOdds() * confidence));
        }
        Map<SignalType, Double> damping = dampingFactors(evidence);

        double logOdds = Math.log(PRIOR / (1.0 - PRIOR));
        double alignedWeight = 0.0;
        double triggeredWeight = 0.0;
        int aligned = 0;
        int opposed = 0;
        List<SignalContribution> contributions = new ArrayList<>();
        for (SignalType type : SignalType.values()) {
            SignalInput signal = input.get(type);
            Evidence item = evidence.stream().filter(e -> e.type() == type).findFirst().orElse(null);
            if (item == null) {
                contributions.add(new SignalContribution(type, SignalBias.NEUTRAL, false,
                        signal != null ? signal.getConfidence() : 0.0, 0.0, 0.0, "Not triggered"));
                continue;
            }
            double factor = damping.getOrDefault(type, 1.0);
            double delta = DecimalUtils.clamp(item.rawDelta() * factor, -MAX_SIGNAL_LOG_ODDS, MAX_SIGNAL_LOG_ODDS);
            logOdds += delta;
            triggeredWeight += type.weight();
            if (item.sign() > 0) {
                aligned++;
                alignedWeight += type.weight();
            } else if (item.sign() < 0) {
                opposed++;
            }
            contributions.add(new SignalContribution(type, item.bias(), true, item.confidence(),
                    factor, DecimalUtils.round(delta, 4), reason(type, signal, item.bias())));
        }

        if (triggeredWeight > 0 && direction != SignalBias.NEUTRAL) {
            logOdds += CONFLUENCE_BOOST * (alignedWeight / triggeredWeight);
        }
        double probability = DecimalUtils.clamp(1.0 / (1.0 + Math.exp(-logOdds)), MIN_PROBABILITY, MAX_PROBABILITY);
        int percent = (int) Math.round(probability * 100);
        ConvictionLabel label = direction == SignalBias.NEUTRAL
                ? ConvictionLabel.NO_CLEAR_SIGNAL
                : ConvictionLabel.fromPercent(percent);

        List<String> gateFailures = kellyGateFailures(aligned, probability, b);
        double kelly = gateFailures.isEmpty() ? kellyFraction(probability, b, options) : 0.0;
        if (!gateFailures.isEmpty()) {
            log.debug("Kelly sizing withheld: {}", gateFailures);
        }

        int totalSignals = SignalType.values().length;
        return new ProbabilityResult(
                DecimalUtils.round(probability, 4),
                percent,
                label,
                direction,
                aligned,
                opposed,
                totalSignals,
                (int) Math.round(aligned * 100.0 / totalSignals),
                DecimalUtils.round(logOdds, 4),
                b,
                gateFailures.isEmpty(),
                DecimalUtils.round(kelly, 4),
                DecimalUtils.round1(kelly * 100),
                List.copyOf(gateFailures),
                List.copyOf(contributions)
        );
    }

    /**
     * Damped Kelly fraction, capped tighter for options.
     */
    public double kellyFraction(double winProbability, double rewardRisk, boolean options) {
        if (rewardRisk <= 0) {
            return 0.0;
        }
        double fullKelly = (winProbability * rewardRisk - (1.0 - winProbability)) / rewardRisk;
        double damped = Math.max(0.0, fullKelly * executionProperties.getKellyDamper());
        return Math.min(damped, options ? KELLY_CAP_OPTIONS : KELLY_CAP_DEFAULT);
    }

    private List<String> kellyGateFailures(int aligned, double probability, double rewardRisk) {
        List<String> failures = new ArrayList<>();
        if (aligned < KELLY_MIN_ALIGNED) {
            failures.add(String.format("ALIGNED_SIGNALS %d < %d", aligned, KELLY_MIN_ALIGNED));
        }
        if (probability < KELLY_MIN_PROBABILITY) {
            failures.add(String.format("WIN_PROBABILITY %.2f < %.2f", probability, KELLY_MIN_PROBABILITY));
        }
        double breakEven = 1.0 / (1.0 + rewardRisk);
        if (probability <= breakEven + KELLY_EDGE_BUFFER) {
            failures.add(String.format("EDGE %.2f <= break-even %.2f + %.2f", probability, breakEven, KELLY_EDGE_BUFFER));
        }
        return failures;
    }

    private Map<SignalType, Double> dampingFactors(List<Evidence> evidence) {
        Map<SignalType, Double> factors = new EnumMap<>(SignalType.class);
        for (SignalCluster cluster : SignalCluster.values()) {
            for (int sign : new int[]{1, -1}) {
                List<Evidence> group = evidence.stream()
                        .filter(e -> e.type().cluster() == cluster && e.sign() == sign)
                        .sorted(Comparator.comparingDouble((Evidence e) -> Math.abs(e.rawDelta())).reversed())
                        .toList();
                for (int i = 0; i < group.size(); i++) {
                    factors.put(group.get(i).type(), cluster.damping(i));
                }
            }
        }
        return factors;
    }

    private SignalBias biasOf(SignalType type, SignalInput signal, SignalBias requested) {
        return switch (type) {
            case UNUSUAL_ACTIVITY -> {
                double calls = signal.getCallPremium() != null ? signal.getCallPremium() : 0.0;
                double puts = signal.getPutPremium() != null ? signal.getPutPremium() : 0.0;
                yield calls > puts ? SignalBias.BULLISH : puts > 0 ? SignalBias.BEARISH : SignalBias.NEUTRAL;
            }
            case PUT_CALL_RATIO -> {
                double ratio = signal.getPutCallRatio() != null ? signal.getPutCallRatio() : 1.0;
                yield ratio < 0.7 ? SignalBias.BULLISH : ratio > 1.0 ? SignalBias.BEARISH : SignalBias.NEUTRAL;
            }
            case MAX_PAIN_DISTANCE -> {
                if (signal.getMaxPain() == null || signal.getCurrentPrice() == null) {
                    yield SignalBias.NEUTRAL;
                }
                double gap = signal.getCurrentPrice() - signal.getMaxPain();
                yield gap > 0 ? SignalBias.BEARISH : gap < 0 ? SignalBias.BULLISH : SignalBias.NEUTRAL;
            }
            case TIME_CONFLUENCE -> {
                int stack = signal.getTimeframeStack() != null ? signal.getTimeframeStack() : 0;
                yield stack > 0 ? SignalBias.BULLISH : stack < 0 ? SignalBias.BEARISH : SignalBias.NEUTRAL;
            }
            // IV shapes the structure, not the direction
            case IV_RANK -> SignalBias.NEUTRAL;
            case TREND_ALIGNMENT -> signal.getAboveEma200() == null ? SignalBias.NEUTRAL
                    : signal.getAboveEma200() ? SignalBias.BULLISH : SignalBias.BEARISH;
            case RSI_MOMENTUM -> {
                double rsi = signal.getRsi() != null ? signal.getRsi() : 50.0;
                if (rsi >= 55 && rsi <= 70) {
                    yield SignalBias.BULLISH;
                }
                if (rsi > 70 || (rsi >= 30 && rsi <= 45)) {
                    yield SignalBias.BEARISH;
                }
                yield rsi < 30 ? SignalBias.BULLISH : SignalBias.NEUTRAL;
            }
            case VOLUME_CONFIRMATION -> requested != null ? requested : SignalBias.NEUTRAL;
        };
    }

    private String reason(SignalType type, SignalInput signal, SignalBias bias) {
        return switch (type) {
            case UNUSUAL_ACTIVITY -> {
                double flow = Math.max(
                        signal.getCallPremium() != null ? signal.getCallPremium() : 0.0,
                        signal.getPutPremium() != null ? signal.getPutPremium() : 0.0);
                yield flow > 0
                        ? String.format("$%,.0f %s premium (%s alert)", flow,
                        bias == SignalBias.BULLISH ? "call" : "put",
                        signal.getAlertLevel() != null ? signal.getAlertLevel() : "moderate")
                        : "Smart money detected";
            }
            case PUT_CALL_RATIO -> String.format("P/C %.2f", signal.getPutCallRatio() != null ? signal.getPutCallRatio() : 1.0);
            case MAX_PAIN_DISTANCE -> signal.getMaxPain() != null
                    ? String.format("Max pain %.2f", signal.getMaxPain())
                    : "Max pain level detected";
            case TIME_CONFLUENCE -> "Stack: " + (signal.getTimeframeStack() != null ? signal.getTimeframeStack() : 0);
            case IV_RANK -> String.format("IV rank %.0f%%", signal.getIvRank() != null ? signal.getIvRank() : 50.0);
            case TREND_ALIGNMENT -> signal.getAboveEma200() == null ? "Price near EMA200"
                    : signal.getAboveEma200() ? "Price above EMA200" : "Price below EMA200";
            case RSI_MOMENTUM -> String.format("RSI %.0f", signal.getRsi() != null ? signal.getRsi() : 50.0);
            case VOLUME_CONFIRMATION -> "Above-average volume";
        };
    }

    private record Evidence(SignalType type, SignalBias bias, int sign, double confidence, double rawDelta) {
    }
}
