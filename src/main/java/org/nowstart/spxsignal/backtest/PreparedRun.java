package org.nowstart.spxsignal.backtest;

import org.nowstart.spxsignal.feature.FeatureSeries;
import org.nowstart.spxsignal.strategy.learned.LearnedStrategy;
import org.nowstart.spxsignal.strategy.learned.TrainingReport;

/**
 * Features plus the simulated window for one walk-forward run. The learned strategy, when present,
 * was fitted on bars before {@code startIndex} only and is read-only from here on.
 */
public record PreparedRun(
        String symbol,
        FeatureSeries features,
        int startIndex,
        LearnedStrategy learned,
        TrainingReport training
) {
}
