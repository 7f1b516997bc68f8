package org.nowstart.spxsignal.ensemble;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.spxsignal.data.type.SignalType;
import org.nowstart.spxsignal.feature.FeatureVector;
import org.nowstart.spxsignal.strategy.core.Signal;
import org.nowstart.spxsignal.strategy.core.SignalStrategy;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.nowstart.spxsignal.strategy.core.StrategyEvaluation;
import org.springframework.stereotype.Component;

/**
 * Fixed-weight vote across strategies. Each vote adds its weight to its signal class; the heaviest
 * class wins and its accumulated weight becomes the combined confidence. Any tie for the top weight
 * resolves to HOLD.
 */
@Slf4j
@Component
public class EnsembleCombiner {

    static final double TIE_EPSILON = 1e-12;

    public CombinedSignal evaluate(FeatureVector features, List<SignalStrategy> strategies, StrategyConfig config) {
        List<StrategyVote> votes = new ArrayList<>(strategies.size());
        for (SignalStrategy strategy : strategies) {
            StrategyEvaluation evaluation = strategy.evaluate(features);
            votes.add(new StrategyVote(strategy.name(), config.weight(strategy.kind()), evaluation.signal(), evaluation.diagnostics()));
        }
        return combine(features.timestamp(), votes);
    }

    public CombinedSignal combine(Instant timestamp, List<StrategyVote> votes) {
        Map<SignalType, Double> accumulated = new EnumMap<>(SignalType.class);
        for (SignalType type : SignalType.values()) {
            accumulated.put(type, 0.0);
        }
        for (StrategyVote vote : votes) {
            accumulated.merge(vote.signal().type(), vote.weight(), Double::sum);
        }

        double top = Double.NEGATIVE_INFINITY;
        for (double weight : accumulated.values()) {
            top = Math.max(top, weight);
        }
        SignalType winner = null;
        int leaders = 0;
        for (Map.Entry<SignalType, Double> entry : accumulated.entrySet()) {
            if (Math.abs(entry.getValue() - top) <= TIE_EPSILON) {
                winner = entry.getKey();
                leaders++;
            }
        }
        if (leaders != 1) {
            winner = SignalType.HOLD;
        }

        double confidence = Math.min(1.0, Math.max(0.0, accumulated.get(winner)));
        CombinedSignal combined = new CombinedSignal(
                timestamp,
                new Signal(winner, confidence, CombinedSignal.ENSEMBLE_NAME),
                accumulated,
                votes
        );
        log.debug("[Ensemble] ts={} signal={} confidence={} weights={}", timestamp, winner, confidence, accumulated);
        return combined;
    }
}
