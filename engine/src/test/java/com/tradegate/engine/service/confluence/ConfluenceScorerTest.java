package com.tradegate.engine.service.confluence;

import com.tradegate.engine.model.MarketRegime;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfluenceScorerTest {

    private final ConfluenceScorer scorer = new ConfluenceScorer();

    @Test
    void trendExpansionExampleIsConditional() {
        ConfluenceComponents components = new ConfluenceComponents(70, 60, 55, 50, 45, 40);

        ConfluenceResult result = scorer.score(components, ScoringRegime.TREND_EXPANSION);

        assertThat(result.gated()).isFalse();
        assertThat(result.gateViolations()).isEmpty();
        assertThat(result.weightedScore()).isCloseTo(55.25, within(0.1));
        assertThat(result.tradeBias()).isEqualTo(TradeBias.CONDITIONAL);
    }

    @Test
    void failedGateCapsScoreAtFiftyFive() {
        ConfluenceComponents components = new ConfluenceComponents(90, 90, 90, 90, 30, 90);

        ConfluenceResult result = scorer.score(components, ScoringRegime.TREND_EXPANSION);

        assertThat(result.gated()).isTrue();
        assertThat(result.rawScore()).isCloseTo(78.0, within(0.01));
        assertThat(result.weightedScore()).isEqualTo(ConfluenceScorer.GATED_SCORE_CAP);
        assertThat(result.tradeBias()).isEqualTo(TradeBias.CONDITIONAL);
        assertThat(result.gateViolations()).containsExactly("MTF=30 < gate 40");
    }

    @Test
    void gateCappingIsIdempotent() {
        ConfluenceComponents components = new ConfluenceComponents(90, 40, 90, 90, 90, 90);

        ConfluenceResult first = scorer.score(components, ScoringRegime.TREND_EXPANSION);
        ConfluenceResult second = scorer.score(first.components(), first.regime());

        assertThat(second.weightedScore()).isEqualTo(first.weightedScore());
        assertThat(second.tradeBias()).isEqualTo(first.tradeBias());
    }

    @Test
    void scoresStayWithinBoundsForEveryRegime() {
        ConfluenceComponents high = new ConfluenceComponents(250, 180, 150, 300, 120, 101);
        ConfluenceComponents low = new ConfluenceComponents(-20, -5, -100, 0, 0, -1);
        for (ScoringRegime regime : ScoringRegime.values()) {
            assertThat(scorer.score(high, regime).weightedScore()).isBetween(0.0, 100.0);
            assertThat(scorer.score(low, regime).weightedScore()).isBetween(0.0, 100.0);
            assertThat(scorer.score(low, regime).tradeBias()).isEqualTo(TradeBias.NEUTRAL);
        }
    }

    @Test
    void nonFiniteComponentScoresAsNeutralMidpoint() {
        ConfluenceComponents components = new ConfluenceComponents(Double.NaN, 60, 55, 50, 45, 40);

        ConfluenceResult result = scorer.score(components, ScoringRegime.TREND_EXPANSION);

        assertThat(result.components().signalQuality()).isEqualTo(50.0);
        assertThat(result.weightedScore()).isCloseTo(51.25, within(0.01));
        assertThat(result.tradeBias()).isEqualTo(TradeBias.NEUTRAL);

        ConfluenceComponents infinite = new ConfluenceComponents(70, Double.POSITIVE_INFINITY, 55, 50, 45, 40);
        assertThat(scorer.score(infinite, ScoringRegime.TREND_EXPANSION).components().technicalAlignment()).isEqualTo(50.0);
        assertThat(TradeBias.fromScore(Double.NaN)).isEqualTo(TradeBias.NEUTRAL);
    }

    @Test
    void marketRegimeMapsToScoringRegime() {
        ConfluenceResult result = scorer.score(ConfluenceComponents.neutral(), MarketRegime.VOL_CONTRACTION);

        assertThat(result.regime()).isEqualTo(ScoringRegime.RANGE_COMPRESSION);
        assertThat(ScoringRegime.resolve("trend mature")).isEqualTo(ScoringRegime.TREND_MATURE);
        assertThat(ScoringRegime.resolve("something else")).isEqualTo(ScoringRegime.TRANSITION);
    }

    @Test
    void biasStepsUpWithScore() {
        assertThat(TradeBias.fromScore(54.9)).isEqualTo(TradeBias.NEUTRAL);
        assertThat(TradeBias.fromScore(55)).isEqualTo(TradeBias.CONDITIONAL);
        assertThat(TradeBias.fromScore(70)).isEqualTo(TradeBias.VALID);
        assertThat(TradeBias.fromScore(85)).isEqualTo(TradeBias.HIGH_CONFLUENCE);
    }
}
