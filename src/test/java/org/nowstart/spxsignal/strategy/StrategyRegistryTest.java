package org.nowstart.spxsignal.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.spxsignal.data.exception.ModelNotTrainedException;
import org.nowstart.spxsignal.data.type.StrategyKind;
import org.nowstart.spxsignal.strategy.core.SignalStrategy;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.nowstart.spxsignal.strategy.learned.LearnedModelParams;
import org.nowstart.spxsignal.strategy.learned.LearnedStrategy;

class StrategyRegistryTest {

    private final StrategyRegistry registry = new StrategyRegistry();

    @Test
    void activeStrategies_skipsZeroWeightKindsInEnumOrder() {
        Map<StrategyKind, Double> weights = new EnumMap<>(StrategyKind.class);
        weights.put(StrategyKind.VOLATILITY_BREAKOUT, 0.4);
        weights.put(StrategyKind.MEAN_REVERSION, 0.6);
        weights.put(StrategyKind.MOMENTUM_BREAKOUT, 0.0);
        StrategyConfig config = StrategyConfig.defaults().withWeights(weights);

        List<SignalStrategy> strategies = registry.activeStrategies(config, null);

        assertThat(strategies).extracting(SignalStrategy::kind)
                .containsExactly(StrategyKind.MEAN_REVERSION, StrategyKind.VOLATILITY_BREAKOUT);
    }

    @Test
    void activeStrategies_requiresTrainedModelWhenLearnedIsWeighted() {
        StrategyConfig config = StrategyConfig.defaults();

        assertThatThrownBy(() -> registry.activeStrategies(config, null))
                .isInstanceOf(ModelNotTrainedException.class);
        assertThatThrownBy(() -> registry.activeStrategies(config, new LearnedStrategy(LearnedModelParams.DEFAULTS)))
                .isInstanceOf(ModelNotTrainedException.class)
                .hasFieldOrPropertyWithValue("component", "strategy-registry");
    }

    @Test
    void create_buildsEachRuleStrategy() {
        StrategyConfig config = StrategyConfig.defaults();

        assertThat(registry.create(StrategyKind.MEAN_REVERSION, config, null).name()).isEqualTo("mean_reversion");
        assertThat(registry.create(StrategyKind.MOMENTUM_BREAKOUT, config, null).name()).isEqualTo("momentum_breakout");
        assertThat(registry.create(StrategyKind.VOLATILITY_BREAKOUT, config, null).name()).isEqualTo("volatility_breakout");
    }
}
