package org.nowstart.spxsignal.strategy.rule;

import org.nowstart.spxsignal.data.exception.InvalidConfigurationException;

public record MomentumBreakoutParams(
        double adxThreshold,
        double volumeConfirmRatio
) {

    public static final MomentumBreakoutParams DEFAULTS = new MomentumBreakoutParams(25.0, 1.2);

    public MomentumBreakoutParams {
        if (adxThreshold <= 0.0 || adxThreshold >= 100.0) {
            throw new InvalidConfigurationException("momentum adx-threshold must be in (0, 100)");
        }
        if (volumeConfirmRatio <= 0.0) {
            throw new InvalidConfigurationException("momentum volume-confirm-ratio must be > 0");
        }
    }
}
