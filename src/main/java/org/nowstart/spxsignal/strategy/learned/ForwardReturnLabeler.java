package org.nowstart.spxsignal.strategy.learned;

import java.util.Optional;
import org.nowstart.spxsignal.data.type.SignalType;

/**
 * Labels a bar by its forward N-bar close-to-close return.
 */
public final class ForwardReturnLabeler {

    private final LearnedModelParams params;

    public ForwardReturnLabeler(LearnedModelParams params) {
        this.params = params;
    }

    /**
     * @param close            close prices
     * @param index            bar to label
     * @param limitExclusive   first bar the label may not look at
     * @return empty when the forward bar falls at or beyond {@code limitExclusive}
     */
    public Optional<SignalType> label(double[] close, int index, int limitExclusive) {
        int forward = index + params.horizonBars();
        if (forward >= limitExclusive || forward >= close.length || close[index] <= 0.0) {
            return Optional.empty();
        }
        double forwardReturn = (close[forward] / close[index]) - 1.0;
        if (forwardReturn > params.buyReturn()) {
            return Optional.of(SignalType.BUY);
        }
        if (forwardReturn < params.sellReturn()) {
            return Optional.of(SignalType.SELL);
        }
        return Optional.of(SignalType.HOLD);
    }
}
