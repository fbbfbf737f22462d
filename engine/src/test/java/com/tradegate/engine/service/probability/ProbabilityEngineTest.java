package com.tradegate.engine.service.probability;

import com.tradegate.engine.config.ExecutionProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProbabilityEngineTest {

    private final ProbabilityEngine engine = new ProbabilityEngine(new ExecutionProperties());

    @Test
    void noSignalsStaysAtPriorWithoutKelly() {
        ProbabilityResult result = engine.evaluate(TradeSignals.none(), SignalBias.NEUTRAL, 2.0, false);

        assertThat(result.winProbability()).isEqualTo(0.5);
        assertThat(result.label()).isEqualTo(ConvictionLabel.NO_CLEAR_SIGNAL);
        assertThat(result.kellyEligible()).isFalse();
        assertThat(result.kellyFraction()).isZero();
    }

    @Test
    void fullBullishStackIsClampedAndSized() {
        ProbabilityResult result = engine.evaluate(bullishStack(), SignalBias.BULLISH, 2.0, false);

        assertThat(result.winProbability()).isEqualTo(0.80);
        assertThat(result.alignedCount()).isEqualTo(7);
        assertThat(result.opposedCount()).isZero();
        assertThat(result.label()).isEqualTo(ConvictionLabel.HIGH_CONVICTION);
        assertThat(result.kellyEligible()).isTrue();
        assertThat(result.kellyFraction()).isCloseTo(0.175, within(1e-4));
    }

    @Test
    void optionsKellyIsCappedTighter() {
        ProbabilityResult result = engine.evaluate(bullishStack(), SignalBias.BULLISH, 2.0, true);

        assertThat(result.kellyFraction()).isEqualTo(0.10);
    }

    @Test
    void fewerThanThreeAlignedSignalsNeverSizes() {
        TradeSignals signals = TradeSignals.builder()
                .signal(SignalType.UNUSUAL_ACTIVITY, SignalInput.builder().triggered(true).confidence(1.0).callPremium(2_000_000.0).build())
                .signal(SignalType.TIME_CONFLUENCE, SignalInput.builder().triggered(true).confidence(1.0).timeframeStack(4).build())
                .build();

        ProbabilityResult result = engine.evaluate(signals, SignalBias.BULLISH, 5.0, false);

        assertThat(result.alignedCount()).isEqualTo(2);
        assertThat(result.kellyFraction()).isZero();
        assertThat(result.kellyGateFailures()).anyMatch(failure -> failure.startsWith("ALIGNED_SIGNALS"));
    }

    @Test
    void opposingEvidenceLowersProbabilityButRespectsFloor() {
        ProbabilityResult result = engine.evaluate(bullishStack(), SignalBias.BEARISH, 2.0, false);

        assertThat(result.opposedCount()).isGreaterThanOrEqualTo(6);
        assertThat(result.winProbability()).isEqualTo(0.35);
        assertThat(result.label()).isEqualTo(ConvictionLabel.UNFAVORABLE);
        assertThat(result.kellyFraction()).isZero();
    }

    @Test
    void neutralRequestFollowsDominantSide() {
        ProbabilityResult result = engine.evaluate(bullishStack(), SignalBias.NEUTRAL, 2.0, false);

        assertThat(result.direction()).isEqualTo(SignalBias.BULLISH);
    }

    @Test
    void nonFiniteConfidenceContributesNothing() {
        TradeSignals signals = TradeSignals.builder()
                .signal(SignalType.PUT_CALL_RATIO, SignalInput.builder().triggered(true).confidence(Double.NaN).putCallRatio(0.5).build())
                .signal(SignalType.TREND_ALIGNMENT, SignalInput.builder().triggered(true).confidence(Double.NaN).aboveEma200(true).build())
                .build();

        ProbabilityResult result = engine.evaluate(signals, SignalBias.BULLISH, 2.0, false);

        assertThat(result.winProbability()).isFinite().isBetween(0.35, 0.80);
        assertThat(result.contributions())
                .filteredOn(SignalContribution::triggered)
                .allSatisfy(contribution -> assertThat(contribution.confidence()).isZero());
        assertThat(result.kellyFraction()).isZero();
    }

    @Test
    void kellyFractionIsDampedAndCapped() {
        assertThat(engine.kellyFraction(0.6, 2.0, false)).isCloseTo(0.10, within(1e-9));
        assertThat(engine.kellyFraction(0.3, 1.0, false)).isZero();
        assertThat(engine.kellyFraction(0.8, 10.0, true)).isEqualTo(0.10);
    }

    private static TradeSignals bullishStack() {
        return TradeSignals.builder()
                .signal(SignalType.UNUSUAL_ACTIVITY, SignalInput.builder().triggered(true).confidence(1.0)
                        .callPremium(1_500_000.0).putPremium(200_000.0).alertLevel("high").build())
                .signal(SignalType.PUT_CALL_RATIO, SignalInput.builder().triggered(true).confidence(1.0).putCallRatio(0.5).build())
                .signal(SignalType.MAX_PAIN_DISTANCE, SignalInput.builder().triggered(true).confidence(1.0)
                        .maxPain(110.0).currentPrice(100.0).build())
                .signal(SignalType.TIME_CONFLUENCE, SignalInput.builder().triggered(true).confidence(1.0).timeframeStack(3).build())
                .signal(SignalType.TREND_ALIGNMENT, SignalInput.builder().triggered(true).confidence(1.0).aboveEma200(true).build())
                .signal(SignalType.RSI_MOMENTUM, SignalInput.builder().triggered(true).confidence(1.0).rsi(62.0).build())
                .signal(SignalType.VOLUME_CONFIRMATION, SignalInput.fired(1.0))
                .build();
    }
}
