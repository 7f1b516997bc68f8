package org.nowstart.spxsignal.service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.spxsignal.data.exception.ModelNotTrainedException;
import org.nowstart.spxsignal.feature.FeatureEngine;
import org.nowstart.spxsignal.feature.FeatureSeries;
import org.nowstart.spxsignal.market.MarketSeries;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.nowstart.spxsignal.strategy.learned.LearnedStrategy;
import org.nowstart.spxsignal.strategy.learned.TrainingReport;
import org.springframework.stereotype.Service;

/**
 * Owns the learned model used by the live query. Each training builds a fresh {@link LearnedStrategy}
 * and swaps it in atomically once fitting succeeds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LearnedModelService {

    private final MarketDataService marketDataService;
    private final FeatureEngine featureEngine;
    private final StrategyConfig strategyConfig;
    private final AtomicReference<LearnedStrategy> installed = new AtomicReference<>();

    public TrainingReport train(Instant from, Instant to) {
        MarketSeries series = marketDataService.loadRange(from, to);
        return train(featureEngine.compute(series));
    }

    public TrainingReport train(FeatureSeries features) {
        LearnedStrategy candidate = new LearnedStrategy(strategyConfig.learned());
        TrainingReport report = candidate.train(features);
        installed.set(candidate);
        log.info("[Learned][INSTALL] trainingRows={} holdoutAccuracy={} trainedThrough={}",
                report.trainingRows(), report.holdoutAccuracy(), report.trainedThrough());
        return report;
    }

    public Optional<LearnedStrategy> current() {
        return Optional.ofNullable(installed.get());
    }

    public LearnedStrategy requireCurrent() {
        return current().orElseThrow(() -> new ModelNotTrainedException("learned-model-service", null));
    }

    public Map<String, Double> featureImportances() {
        return requireCurrent().featureImportances();
    }
}
