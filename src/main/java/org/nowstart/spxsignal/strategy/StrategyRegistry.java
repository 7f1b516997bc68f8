package org.nowstart.spxsignal.strategy;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.nowstart.spxsignal.data.exception.ModelNotTrainedException;
import org.nowstart.spxsignal.data.type.StrategyKind;
import org.nowstart.spxsignal.strategy.core.SignalStrategy;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.nowstart.spxsignal.strategy.learned.LearnedStrategy;
import org.nowstart.spxsignal.strategy.rule.MeanReversionStrategy;
import org.nowstart.spxsignal.strategy.rule.MomentumBreakoutStrategy;
import org.nowstart.spxsignal.strategy.rule.VolatilityBreakoutStrategy;
import org.springframework.stereotype.Service;

/**
 * Builds the strategy instances for one run from its {@link StrategyConfig}. Only strategies with a
 * positive weight are returned, ordered by {@link StrategyKind}.
 */
@Service
public class StrategyRegistry {

    public List<SignalStrategy> activeStrategies(StrategyConfig config, LearnedStrategy learned) {
        if (config == null) {
            throw new IllegalArgumentException("strategy config is required");
        }
        Map<StrategyKind, SignalStrategy> byKind = new EnumMap<>(StrategyKind.class);
        for (StrategyKind kind : StrategyKind.values()) {
            if (!config.isActive(kind)) {
                continue;
            }
            SignalStrategy strategy = create(kind, config, learned);
            SignalStrategy previous = byKind.put(strategy.kind(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate strategy registered for kind=" + kind.key());
            }
        }
        return List.copyOf(byKind.values());
    }

    public SignalStrategy create(StrategyKind kind, StrategyConfig config, LearnedStrategy learned) {
        return switch (kind) {
            case MEAN_REVERSION -> new MeanReversionStrategy(config.meanReversion());
            case MOMENTUM_BREAKOUT -> new MomentumBreakoutStrategy(config.momentumBreakout());
            case VOLATILITY_BREAKOUT -> new VolatilityBreakoutStrategy(config.volatilityBreakout());
            case LEARNED -> requireTrained(learned);
        };
    }

    private SignalStrategy requireTrained(LearnedStrategy learned) {
        if (learned == null || !learned.isTrained()) {
            throw new ModelNotTrainedException("strategy-registry", null);
        }
        return learned;
    }
}
