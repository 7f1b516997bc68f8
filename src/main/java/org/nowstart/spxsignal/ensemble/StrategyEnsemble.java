package org.nowstart.spxsignal.ensemble;

import java.util.List;
import org.nowstart.spxsignal.backtest.SignalSource;
import org.nowstart.spxsignal.feature.FeatureVector;
import org.nowstart.spxsignal.strategy.core.SignalStrategy;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;

/**
 * The active strategies of one run bound to their weights. Owned by a single run or live query.
 */
public class StrategyEnsemble implements SignalSource {

    private final List<SignalStrategy> strategies;
    private final StrategyConfig config;
    private final EnsembleCombiner combiner;

    public StrategyEnsemble(List<SignalStrategy> strategies, StrategyConfig config, EnsembleCombiner combiner) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one active strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.config = config;
        this.combiner = combiner;
    }

    @Override
    public CombinedSignal signalAt(FeatureVector features) {
        return combiner.evaluate(features, strategies, config);
    }
}
