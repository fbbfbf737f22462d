package com.tradegate.engine.service.confluence;

import com.tradegate.engine.model.MarketRegime;
import com.tradegate.engine.util.DecimalUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted multi-factor confluence score with hard per-regime gates.
 */
@Service
@Slf4j
public class ConfluenceScorer {

    /** Highest score a trade can reach while any gate is failing. */
    public static final double GATED_SCORE_CAP = 55.0;

    public ConfluenceResult score(ConfluenceComponents components, MarketRegime regime) {
        return score(components, ScoringRegime.fromMarketRegime(regime));
    }

    public ConfluenceResult score(ConfluenceComponents components, ScoringRegime regime) {
        ScoringRegime effectiveRegime = regime != null ? regime : ScoringRegime.TRANSITION;
        ConfluenceComponents clamped = (components != null ? components : ConfluenceComponents.neutral()).clamped();

        Map<ConfluenceComponent, Double> breakdown = new EnumMap<>(ConfluenceComponent.class);
        double raw = 0.0;
        for (Map.Entry<ConfluenceComponent, Double> weight : effectiveRegime.weights().entrySet()) {
            double contribution = clamped.value(weight.getKey()) * weight.getValue();
            breakdown.put(weight.getKey(), DecimalUtils.round2(contribution));
            raw += contribution;
        }

        List<String> violations = new ArrayList<>();
        for (Map.Entry<ConfluenceComponent, Double> gate : effectiveRegime.gates().entrySet()) {
            double value = clamped.value(gate.getKey());
            if (value < gate.getValue()) {
                violations.add(String.format("%s=%.0f < gate %.0f", gate.getKey().code(), value, gate.getValue()));
            }
        }

        boolean gated = !violations.isEmpty();
        double score = gated ? Math.min(raw, GATED_SCORE_CAP) : DecimalUtils.clampScore(raw);
        if (gated) {
            log.debug("Confluence gated in {}: {} (raw {})", effectiveRegime, violations, raw);
        }

        return new ConfluenceResult(
                effectiveRegime,
                clamped,
                effectiveRegime.weights(),
                DecimalUtils.round2(raw),
                DecimalUtils.round1(score),
                Collections.unmodifiableList(violations),
                gated,
                TradeBias.fromScore(score),
                Collections.unmodifiableMap(breakdown)
        );
    }
}
