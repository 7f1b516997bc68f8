package org.nowstart.spxsignal.strategy.core;

import org.nowstart.spxsignal.data.type.StrategyKind;
import org.nowstart.spxsignal.feature.FeatureVector;

/**
 * Evaluation capability shared by every strategy variant.
 *
 * <p>The set of variants is closed and enumerated by {@link StrategyKind}; the ensemble only needs
 * {@link #kind()} for its weight and {@link #evaluate(FeatureVector)} for the vote.
 */
public interface SignalStrategy {

    StrategyKind kind();

    default String name() {
        return kind().key();
    }

    /**
     * Maps one feature vector to a signal. Rule strategies return HOLD when features are unavailable.
     */
    StrategyEvaluation evaluate(FeatureVector features);
}
