package org.nowstart.spxsignal.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.spxsignal.data.dto.RecommendationDto;
import org.nowstart.spxsignal.data.dto.StrategyVoteDto;
import org.nowstart.spxsignal.data.exception.InsufficientHistoryException;
import org.nowstart.spxsignal.data.type.OptionSide;
import org.nowstart.spxsignal.data.type.SignalType;
import org.nowstart.spxsignal.data.type.StrategyKind;
import org.nowstart.spxsignal.ensemble.CombinedSignal;
import org.nowstart.spxsignal.ensemble.EnsembleCombiner;
import org.nowstart.spxsignal.ensemble.StrategyEnsemble;
import org.nowstart.spxsignal.ensemble.StrategyVote;
import org.nowstart.spxsignal.feature.FeatureEngine;
import org.nowstart.spxsignal.feature.FeatureName;
import org.nowstart.spxsignal.feature.FeatureVector;
import org.nowstart.spxsignal.market.MarketSeries;
import org.nowstart.spxsignal.strategy.StrategyRegistry;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.nowstart.spxsignal.strategy.core.StrategyDiagnostic;
import org.nowstart.spxsignal.strategy.learned.LearnedStrategy;
import org.springframework.stereotype.Service;

/**
 * Read-only "current recommendation" over the latest available bar. Nothing computed here is retained.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

    static final double HIGH_VOLATILITY_INDEX = 25.0;
    static final double LOW_VOLATILITY_INDEX = 15.0;

    private final MarketDataService marketDataService;
    private final FeatureEngine featureEngine;
    private final StrategyRegistry strategyRegistry;
    private final EnsembleCombiner ensembleCombiner;
    private final LearnedModelService learnedModelService;
    private final StrategyConfig strategyConfig;

    public RecommendationDto currentRecommendation() {
        MarketSeries series = marketDataService.loadLatest();
        if (series.isEmpty()) {
            throw new InsufficientHistoryException("recommendation", null, "No bars available for " + series.symbol());
        }
        LearnedStrategy learned = strategyConfig.isActive(StrategyKind.LEARNED) ? learnedModelService.requireCurrent() : null;
        StrategyEnsemble ensemble = new StrategyEnsemble(
                strategyRegistry.activeStrategies(strategyConfig, learned),
                strategyConfig,
                ensembleCombiner
        );

        FeatureVector latest = featureEngine.compute(series).latest();
        CombinedSignal combined = ensemble.signalAt(latest);
        SignalType type = combined.type();
        log.info("[Recommendation] symbol={} ts={} signal={} confidence={}",
                series.symbol(), latest.timestamp(), type, combined.confidence());

        return new RecommendationDto(
                series.symbol(),
                latest.timestamp(),
                type,
                combined.confidence(),
                type.isActionable() ? OptionSide.forSignal(type) : null,
                advice(type, latest),
                keyIndicators(latest),
                votes(combined)
        );
    }

    static String advice(SignalType type, FeatureVector features) {
        List<String> notes = new ArrayList<>();
        OptionalDouble rsi = features.get(FeatureName.RSI_14);
        switch (type) {
            case BUY -> {
                notes.add("Consider buying call options");
                if (rsi.isPresent() && rsi.getAsDouble() < 40.0) {
                    notes.add("RSI indicates oversold conditions - good for calls");
                }
            }
            case SELL -> {
                notes.add("Consider buying put options");
                if (rsi.isPresent() && rsi.getAsDouble() > 60.0) {
                    notes.add("RSI indicates overbought conditions - good for puts");
                }
            }
            case HOLD -> notes.add("No clear signal - consider staying in cash");
        }
        OptionalDouble volatilityIndex = features.get(FeatureName.VOLATILITY_INDEX);
        if (volatilityIndex.isPresent() && volatilityIndex.getAsDouble() > HIGH_VOLATILITY_INDEX) {
            notes.add("High VIX suggests elevated volatility - consider shorter-term trades");
        } else if (volatilityIndex.isPresent() && volatilityIndex.getAsDouble() < LOW_VOLATILITY_INDEX) {
            notes.add("Low VIX suggests low volatility - consider longer-term trades");
        }
        return String.join(" | ", notes);
    }

    static Map<String, Double> keyIndicators(FeatureVector features) {
        Map<String, Double> out = new LinkedHashMap<>();
        features.get(FeatureName.CLOSE).ifPresent(value -> out.put("price", value));
        features.get(FeatureName.RSI_14).ifPresent(value -> out.put("rsi", value));
        features.get(FeatureName.MACD).ifPresent(value -> out.put("macd", value));
        features.get(FeatureName.VOLATILITY_INDEX).ifPresent(value -> out.put("vix", value));
        OptionalDouble close = features.get(FeatureName.CLOSE);
        OptionalDouble sma20 = features.get(FeatureName.SMA_20);
        if (close.isPresent() && sma20.isPresent() && sma20.getAsDouble() != 0.0) {
            out.put("priceVsSma20Pct", (close.getAsDouble() - sma20.getAsDouble()) / sma20.getAsDouble() * 100.0);
        }
        return out;
    }

    private static List<StrategyVoteDto> votes(CombinedSignal combined) {
        List<StrategyVoteDto> out = new ArrayList<>(combined.votes().size());
        for (StrategyVote vote : combined.votes()) {
            Map<String, Object> diagnostics = new LinkedHashMap<>();
            for (StrategyDiagnostic diagnostic : vote.diagnostics()) {
                diagnostics.put(diagnostic.key(), diagnostic.value());
            }
            out.add(new StrategyVoteDto(
                    vote.strategyName(),
                    vote.weight(),
                    vote.signal().type(),
                    vote.signal().confidence(),
                    diagnostics
            ));
        }
        return out;
    }
}
