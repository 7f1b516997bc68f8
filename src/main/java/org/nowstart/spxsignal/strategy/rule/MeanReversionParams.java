package org.nowstart.spxsignal.strategy.rule;

import org.nowstart.spxsignal.data.exception.InvalidConfigurationException;

public record MeanReversionParams(
        double rsiOversold,
        double rsiOverbought,
        double bandPositionLow,
        double bandPositionHigh,
        double williamsOversold,
        double williamsOverbought,
        double volumeSpikeRatio
) {

    public static final MeanReversionParams DEFAULTS = new MeanReversionParams(30.0, 70.0, 0.05, 0.95, -80.0, -20.0, 1.5);

    public MeanReversionParams {
        if (rsiOversold <= 0.0 || rsiOverbought >= 100.0 || rsiOversold >= rsiOverbought) {
            throw new InvalidConfigurationException("mean-reversion RSI thresholds must satisfy 0 < oversold < overbought < 100");
        }
        if (bandPositionLow >= bandPositionHigh) {
            throw new InvalidConfigurationException("mean-reversion band-position-low must be < band-position-high");
        }
        if (williamsOversold < -100.0 || williamsOverbought > 0.0 || williamsOversold >= williamsOverbought) {
            throw new InvalidConfigurationException("mean-reversion Williams %R thresholds must satisfy -100 <= oversold < overbought <= 0");
        }
        if (volumeSpikeRatio <= 0.0) {
            throw new InvalidConfigurationException("mean-reversion volume-spike-ratio must be > 0");
        }
    }
}
