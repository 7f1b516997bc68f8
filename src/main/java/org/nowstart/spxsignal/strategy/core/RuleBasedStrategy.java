package org.nowstart.spxsignal.strategy.core;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.spxsignal.data.exception.InsufficientHistoryException;
import org.nowstart.spxsignal.feature.FeatureVector;

/**
 * Base for threshold strategies. Missing features raised through {@link FeatureVector#require} are
 * converted into a HOLD evaluation carrying the reason.
 */
@Slf4j
public abstract class RuleBasedStrategy implements SignalStrategy {

    @Override
    public final StrategyEvaluation evaluate(FeatureVector features) {
        if (features == null) {
            throw new IllegalArgumentException("features are required");
        }
        try {
            return decide(features);
        } catch (InsufficientHistoryException e) {
            log.trace("[Strategy][{}] hold ts={} reason={}", name(), features.timestamp(), e.getMessage());
            return new StrategyEvaluation(
                    Signal.hold(name()),
                    List.of(StrategyDiagnostic.text("history.missing", "Missing History", "Feature unavailable at this bar", e.getMessage()))
            );
        }
    }

    protected abstract StrategyEvaluation decide(FeatureVector features);

    /**
     * Confidence as the fraction of satisfied sub-conditions.
     */
    protected static double fraction(int satisfied, int total) {
        if (total <= 0) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, satisfied / (double) total));
    }

    protected static int count(boolean... conditions) {
        int satisfied = 0;
        for (boolean condition : conditions) {
            if (condition) {
                satisfied++;
            }
        }
        return satisfied;
    }
}
