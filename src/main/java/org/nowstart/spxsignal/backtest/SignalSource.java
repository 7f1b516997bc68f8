package org.nowstart.spxsignal.backtest;

import org.nowstart.spxsignal.ensemble.CombinedSignal;
import org.nowstart.spxsignal.feature.FeatureVector;

/**
 * Supplies the combined signal for one bar. Called once per bar in timestamp order.
 */
@FunctionalInterface
public interface SignalSource {

    CombinedSignal signalAt(FeatureVector features);
}
