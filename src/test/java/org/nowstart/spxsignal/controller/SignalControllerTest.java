package org.nowstart.spxsignal.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.spxsignal.backtest.BacktestResult;
import org.nowstart.spxsignal.data.dto.BacktestRequest;
import org.nowstart.spxsignal.data.dto.ModelTrainRequest;
import org.nowstart.spxsignal.data.dto.RecommendationDto;
import org.nowstart.spxsignal.data.type.SignalType;
import org.nowstart.spxsignal.report.PerformanceSummary;
import org.nowstart.spxsignal.service.BacktestService;
import org.nowstart.spxsignal.service.LearnedModelService;
import org.nowstart.spxsignal.service.RecommendationService;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.nowstart.spxsignal.strategy.learned.TrainingReport;

@ExtendWith(MockitoExtension.class)
class SignalControllerTest {

    private static final Instant FROM = Instant.parse("2020-01-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private RecommendationService recommendationService;

    @Mock
    private LearnedModelService learnedModelService;

    @Mock
    private BacktestService backtestService;

    @InjectMocks
    private SignalController signalController;

    @Test
    void getRecommendation_delegatesToService() {
        RecommendationDto expected = new RecommendationDto(
                "SPX", TO, SignalType.HOLD, 0.0, null, "No clear signal - consider staying in cash", Map.of(), List.of());
        when(recommendationService.currentRecommendation()).thenReturn(expected);

        RecommendationDto result = signalController.getRecommendation();

        assertThat(result).isEqualTo(expected);
        verify(recommendationService).currentRecommendation();
    }

    @Test
    void trainModel_passesRequestedRange() {
        TrainingReport expected = new TrainingReport(120, 30, 0.5, Map.of(), Map.of("rsi_14", 1.0), TO);
        when(learnedModelService.train(FROM, TO)).thenReturn(expected);

        TrainingReport result = signalController.trainModel(new ModelTrainRequest(FROM, TO));

        assertThat(result).isEqualTo(expected);
        verify(learnedModelService).train(FROM, TO);
    }

    @Test
    void getFeatureImportances_delegatesToService() {
        Map<String, Double> expected = Map.of("rsi_14", 0.7, "macd", 0.3);
        when(learnedModelService.featureImportances()).thenReturn(expected);

        assertThat(signalController.getFeatureImportances()).isEqualTo(expected);
    }

    @Test
    void runBacktest_passesRangeAndTrainingRatio() {
        PerformanceSummary summary = PerformanceSummary.builder().initialCapital(100_000.0).finalCapital(100_000.0).build();
        BacktestResult expected = new BacktestResult("SPX", StrategyConfig.defaults(), List.of(), List.of(), summary, null);
        when(backtestService.run(FROM, TO, 0.6)).thenReturn(expected);

        BacktestResult result = signalController.runBacktest(new BacktestRequest(FROM, TO, 0.6));

        assertThat(result).isEqualTo(expected);
        verify(backtestService).run(FROM, TO, 0.6);
    }
}
