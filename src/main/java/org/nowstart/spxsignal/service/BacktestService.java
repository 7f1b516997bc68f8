package org.nowstart.spxsignal.service;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.spxsignal.backtest.BacktestEngine;
import org.nowstart.spxsignal.backtest.BacktestResult;
import org.nowstart.spxsignal.backtest.PreparedRun;
import org.nowstart.spxsignal.data.exception.InsufficientHistoryException;
import org.nowstart.spxsignal.data.property.BacktestProperties;
import org.nowstart.spxsignal.data.type.StrategyKind;
import org.nowstart.spxsignal.ensemble.EnsembleCombiner;
import org.nowstart.spxsignal.ensemble.StrategyEnsemble;
import org.nowstart.spxsignal.feature.FeatureEngine;
import org.nowstart.spxsignal.feature.FeatureSeries;
import org.nowstart.spxsignal.market.MarketSeries;
import org.nowstart.spxsignal.strategy.StrategyRegistry;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.nowstart.spxsignal.strategy.learned.LearnedStrategy;
import org.nowstart.spxsignal.strategy.learned.TrainingReport;
import org.springframework.stereotype.Service;

/**
 * Walk-forward orchestration: features over the whole range, learned strategy fitted on the leading
 * training window, simulation over the remaining bars.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestService {

    private final MarketDataService marketDataService;
    private final FeatureEngine featureEngine;
    private final StrategyRegistry strategyRegistry;
    private final EnsembleCombiner ensembleCombiner;
    private final BacktestEngine backtestEngine;
    private final BacktestProperties backtestProperties;
    private final StrategyConfig strategyConfig;

    public BacktestResult run(Instant from, Instant to, Double trainingRatio) {
        MarketSeries series = marketDataService.loadRange(from, to);
        double ratio = trainingRatio != null ? trainingRatio : backtestProperties.trainingRatio();
        PreparedRun prepared = prepare(series, strategyConfig, ratio);
        return execute(prepared, strategyConfig);
    }

    public PreparedRun prepare(MarketSeries series, StrategyConfig config, double trainingRatio) {
        FeatureSeries features = featureEngine.compute(series);
        if (!config.isActive(StrategyKind.LEARNED)) {
            return new PreparedRun(series.symbol(), features, 0, null, null);
        }
        if (series.size() < 4) {
            throw new InsufficientHistoryException("backtest", null,
                    "At least 4 bars are required for a walk-forward run, got " + series.size());
        }
        int split = splitIndex(features.size(), trainingRatio);
        LearnedStrategy learned = new LearnedStrategy(config.learned());
        TrainingReport report = learned.train(features, split);
        log.info("[Backtest][SPLIT] train={} -> {} test={} -> {}",
                features.bar(0).timestamp(), features.bar(split - 1).timestamp(),
                features.bar(split).timestamp(), features.bar(features.size() - 1).timestamp());
        return new PreparedRun(series.symbol(), features, split, learned, report);
    }

    public BacktestResult execute(PreparedRun prepared, StrategyConfig config) {
        StrategyEnsemble ensemble = new StrategyEnsemble(
                strategyRegistry.activeStrategies(config, prepared.learned()),
                config,
                ensembleCombiner
        );
        BacktestResult result = backtestEngine.run(
                prepared.symbol(),
                prepared.features(),
                prepared.startIndex(),
                config,
                ensemble
        );
        return result.withTraining(prepared.training());
    }

    static int splitIndex(int totalBars, double trainingRatio) {
        int split = (int) Math.floor(totalBars * trainingRatio);
        return Math.min(Math.max(split, 2), totalBars - 2);
    }
}
