package org.nowstart.spxsignal.ensemble;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.nowstart.spxsignal.data.type.SignalType;
import org.nowstart.spxsignal.strategy.core.Signal;

/**
 * Ensemble output for one timestamp.
 *
 * @param classWeights accumulated vote weight per signal class
 * @param votes        contributing strategies in evaluation order
 */
public record CombinedSignal(
        Instant timestamp,
        Signal signal,
        Map<SignalType, Double> classWeights,
        List<StrategyVote> votes
) {

    public static final String ENSEMBLE_NAME = "ensemble";

    public CombinedSignal {
        if (timestamp == null || signal == null) {
            throw new IllegalArgumentException("timestamp and signal are required");
        }
        EnumMap<SignalType, Double> copy = new EnumMap<>(SignalType.class);
        for (SignalType type : SignalType.values()) {
            copy.put(type, classWeights == null ? 0.0 : classWeights.getOrDefault(type, 0.0));
        }
        classWeights = Collections.unmodifiableMap(copy);
        votes = votes == null ? List.of() : List.copyOf(votes);
    }

    public SignalType type() {
        return signal.type();
    }

    public double confidence() {
        return signal.confidence();
    }
}
