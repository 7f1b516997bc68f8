package org.nowstart.spxsignal.strategy.learned;

import java.util.List;
import java.util.Optional;
import org.nowstart.spxsignal.feature.FeatureName;
import org.nowstart.spxsignal.feature.FeatureVector;

/**
 * Fixed model inputs: oscillators, trend/volatility levels, normalized price ratios and
 * lag-1/lag-2 copies of RSI, MACD and volume ratio.
 */
public final class LearnedFeatureSet {

    public static final List<FeatureName> FEATURES = List.of(
            FeatureName.RSI_14,
            FeatureName.RSI_21,
            FeatureName.MACD,
            FeatureName.MACD_SIGNAL,
            FeatureName.MACD_HIST,
            FeatureName.STOCH_K,
            FeatureName.STOCH_D,
            FeatureName.WILLIAMS_R,
            FeatureName.CCI,
            FeatureName.BB_POSITION,
            FeatureName.BB_WIDTH,
            FeatureName.ATR,
            FeatureName.ADX,
            FeatureName.PLUS_DI,
            FeatureName.MINUS_DI,
            FeatureName.MFI,
            FeatureName.VOLUME_RATIO,
            FeatureName.MOMENTUM,
            FeatureName.RATE_OF_CHANGE,
            FeatureName.VOLATILITY,
            FeatureName.PRICE_SMA20_RATIO,
            FeatureName.PRICE_SMA50_RATIO,
            FeatureName.SMA20_SMA50_RATIO,
            FeatureName.RSI_14_LAG1,
            FeatureName.RSI_14_LAG2,
            FeatureName.MACD_LAG1,
            FeatureName.MACD_LAG2,
            FeatureName.VOLUME_RATIO_LAG1,
            FeatureName.VOLUME_RATIO_LAG2
    );

    private LearnedFeatureSet() {
    }

    public static int dimension() {
        return FEATURES.size();
    }

    /**
     * Model row for the vector, or empty when any input is unavailable at that bar.
     */
    public static Optional<double[]> extract(FeatureVector vector) {
        double[] row = new double[FEATURES.size()];
        for (int i = 0; i < FEATURES.size(); i++) {
            FeatureName name = FEATURES.get(i);
            if (!vector.isAvailable(name)) {
                return Optional.empty();
            }
            row[i] = vector.require(name);
        }
        return Optional.of(row);
    }
}
