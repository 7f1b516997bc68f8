package org.nowstart.spxsignal.strategy.core;

import org.nowstart.spxsignal.data.type.SignalType;

/**
 * Discrete trading decision with a confidence in [0, 1] and the strategy that produced it.
 */
public record Signal(
        SignalType type,
        double confidence,
        String strategyName
) {

    public Signal {
        if (type == null) {
            throw new IllegalArgumentException("signal type is required");
        }
        if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
        if (strategyName == null || strategyName.isBlank()) {
            throw new IllegalArgumentException("strategyName is required");
        }
    }

    public static Signal hold(String strategyName) {
        return new Signal(SignalType.HOLD, 0.0, strategyName);
    }

    public boolean isHold() {
        return type == SignalType.HOLD;
    }
}
