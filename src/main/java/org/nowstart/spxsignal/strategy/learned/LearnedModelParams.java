package org.nowstart.spxsignal.strategy.learned;

import org.nowstart.spxsignal.data.exception.InvalidConfigurationException;

/**
 * @param horizonBars      forward-return horizon N used for labelling
 * @param buyReturn        forward return above which a row is labelled BUY
 * @param sellReturn       forward return below which a row is labelled SELL
 * @param holdoutRatio     trailing share of labelled rows kept out of fitting for accuracy
 * @param minTrainingRows  minimum labelled rows required to train
 */
public record LearnedModelParams(
        int horizonBars,
        double buyReturn,
        double sellReturn,
        double learningRate,
        int epochs,
        double l2Penalty,
        double holdoutRatio,
        int minTrainingRows
) {

    public static final LearnedModelParams DEFAULTS = new LearnedModelParams(5, 0.005, -0.005, 0.1, 300, 1e-3, 0.2, 100);

    public LearnedModelParams {
        if (horizonBars <= 0) {
            throw new InvalidConfigurationException("learned horizon-bars must be > 0");
        }
        if (buyReturn <= sellReturn) {
            throw new InvalidConfigurationException("learned buy-return must be > sell-return");
        }
        if (learningRate <= 0.0 || epochs <= 0 || l2Penalty < 0.0) {
            throw new InvalidConfigurationException("learned optimizer settings are invalid");
        }
        if (holdoutRatio < 0.0 || holdoutRatio >= 1.0) {
            throw new InvalidConfigurationException("learned holdout-ratio must be in [0, 1)");
        }
        if (minTrainingRows <= 0) {
            throw new InvalidConfigurationException("learned min-training-rows must be > 0");
        }
    }
}
