package org.nowstart.spxsignal.strategy.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.nowstart.spxsignal.backtest.OptionProxyParams;
import org.nowstart.spxsignal.backtest.RiskLimits;
import org.nowstart.spxsignal.data.exception.InvalidConfigurationException;
import org.nowstart.spxsignal.data.type.StrategyKind;
import org.nowstart.spxsignal.strategy.learned.LearnedModelParams;
import org.nowstart.spxsignal.strategy.rule.MeanReversionParams;
import org.nowstart.spxsignal.strategy.rule.MomentumBreakoutParams;
import org.nowstart.spxsignal.strategy.rule.VolatilityBreakoutParams;

/**
 * Parameters of one backtest run. Validated on construction; never mutated during a run.
 */
public record StrategyConfig(
        double initialCapital,
        RiskLimits risk,
        Map<StrategyKind, Double> strategyWeights,
        OptionProxyParams optionProxy,
        MeanReversionParams meanReversion,
        MomentumBreakoutParams momentumBreakout,
        VolatilityBreakoutParams volatilityBreakout,
        LearnedModelParams learned
) {

    public static final double WEIGHT_TOLERANCE = 1e-6;

    public StrategyConfig {
        if (!(initialCapital > 0.0) || !Double.isFinite(initialCapital)) {
            throw new InvalidConfigurationException("initial-capital must be > 0");
        }
        if (risk == null || optionProxy == null || meanReversion == null
                || momentumBreakout == null || volatilityBreakout == null || learned == null) {
            throw new InvalidConfigurationException("risk, option-proxy and strategy parameter blocks are required");
        }
        strategyWeights = validateWeights(strategyWeights);
    }

    public static StrategyConfig defaults() {
        Map<StrategyKind, Double> weights = new EnumMap<>(StrategyKind.class);
        weights.put(StrategyKind.MEAN_REVERSION, 0.25);
        weights.put(StrategyKind.MOMENTUM_BREAKOUT, 0.25);
        weights.put(StrategyKind.VOLATILITY_BREAKOUT, 0.20);
        weights.put(StrategyKind.LEARNED, 0.30);
        return new StrategyConfig(
                100_000.0,
                RiskLimits.DEFAULTS,
                weights,
                OptionProxyParams.DEFAULTS,
                MeanReversionParams.DEFAULTS,
                MomentumBreakoutParams.DEFAULTS,
                VolatilityBreakoutParams.DEFAULTS,
                LearnedModelParams.DEFAULTS
        );
    }

    /**
     * Converts configuration-file weights keyed by strategy name; unknown names are a configuration error.
     */
    public static Map<StrategyKind, Double> weightsByName(Map<String, Double> namedWeights) {
        if (namedWeights == null || namedWeights.isEmpty()) {
            throw new InvalidConfigurationException("strategy-weights must not be empty");
        }
        Map<StrategyKind, Double> out = new EnumMap<>(StrategyKind.class);
        namedWeights.forEach((name, weight) -> {
            StrategyKind kind;
            try {
                kind = StrategyKind.fromKey(name);
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException("strategy-weights has unknown strategy: " + name);
            }
            if (out.put(kind, weight) != null) {
                throw new InvalidConfigurationException("strategy-weights lists " + kind.key() + " twice");
            }
        });
        return out;
    }

    public double weight(StrategyKind kind) {
        return strategyWeights.getOrDefault(kind, 0.0);
    }

    public boolean isActive(StrategyKind kind) {
        return weight(kind) > 0.0;
    }

    public StrategyConfig withRisk(RiskLimits newRisk) {
        return new StrategyConfig(initialCapital, newRisk, strategyWeights, optionProxy,
                meanReversion, momentumBreakout, volatilityBreakout, learned);
    }

    public StrategyConfig withWeights(Map<StrategyKind, Double> weights) {
        return new StrategyConfig(initialCapital, risk, weights, optionProxy,
                meanReversion, momentumBreakout, volatilityBreakout, learned);
    }

    public Map<String, Double> namedWeights() {
        Map<String, Double> out = new LinkedHashMap<>();
        strategyWeights.forEach((kind, weight) -> out.put(kind.key(), weight));
        return out;
    }

    private static Map<StrategyKind, Double> validateWeights(Map<StrategyKind, Double> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new InvalidConfigurationException("strategy-weights must not be empty");
        }
        EnumMap<StrategyKind, Double> copy = new EnumMap<>(StrategyKind.class);
        double total = 0.0;
        for (Map.Entry<StrategyKind, Double> entry : weights.entrySet()) {
            if (entry.getKey() == null) {
                throw new InvalidConfigurationException("strategy-weights contains a null strategy");
            }
            Double weight = entry.getValue();
            if (weight == null || !Double.isFinite(weight) || weight < 0.0) {
                throw new InvalidConfigurationException("weight for " + entry.getKey().key() + " must be >= 0");
            }
            copy.put(entry.getKey(), weight);
            total += weight;
        }
        if (Math.abs(total - 1.0) > WEIGHT_TOLERANCE) {
            throw new InvalidConfigurationException("strategy-weights must sum to 1, got " + total);
        }
        return Collections.unmodifiableMap(copy);
    }
}
