package org.nowstart.spxsignal.strategy.rule;

import org.nowstart.spxsignal.data.exception.InvalidConfigurationException;

/**
 * @param contractionFactor prior ATR must sit below {@code contractionFactor * ATR average}
 * @param widthExpansion    band width growth over the prior bar that counts as confirmation
 */
public record VolatilityBreakoutParams(
        double volumeSpikeRatio,
        double rsiUpperExtreme,
        double rsiLowerExtreme,
        double contractionFactor,
        double widthExpansion
) {

    public static final VolatilityBreakoutParams DEFAULTS = new VolatilityBreakoutParams(1.5, 80.0, 20.0, 1.0, 1.1);

    public VolatilityBreakoutParams {
        if (volumeSpikeRatio <= 0.0) {
            throw new InvalidConfigurationException("volatility-breakout volume-spike-ratio must be > 0");
        }
        if (rsiLowerExtreme <= 0.0 || rsiUpperExtreme >= 100.0 || rsiLowerExtreme >= rsiUpperExtreme) {
            throw new InvalidConfigurationException("volatility-breakout RSI extremes must satisfy 0 < lower < upper < 100");
        }
        if (contractionFactor <= 0.0) {
            throw new InvalidConfigurationException("volatility-breakout contraction-factor must be > 0");
        }
        if (widthExpansion <= 0.0) {
            throw new InvalidConfigurationException("volatility-breakout width-expansion must be > 0");
        }
    }
}
