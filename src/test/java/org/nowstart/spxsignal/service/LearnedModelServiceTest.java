package org.nowstart.spxsignal.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.spxsignal.data.exception.InsufficientHistoryException;
import org.nowstart.spxsignal.data.exception.ModelNotTrainedException;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.nowstart.spxsignal.strategy.learned.LearnedStrategy;
import org.nowstart.spxsignal.strategy.learned.TrainingReport;
import org.nowstart.spxsignal.support.BarFixtures;

@ExtendWith(MockitoExtension.class)
class LearnedModelServiceTest {

    private static final Instant FROM = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2025-12-31T00:00:00Z");

    @Mock
    private MarketDataService marketDataService;

    private LearnedModelService learnedModelService;

    @BeforeEach
    void setUp() {
        learnedModelService = new LearnedModelService(marketDataService, BarFixtures.featureEngine(), StrategyConfig.defaults());
    }

    @Test
    void featureImportances_failWithoutInstalledModel() {
        assertThat(learnedModelService.current()).isEmpty();
        assertThatThrownBy(() -> learnedModelService.featureImportances())
                .isInstanceOf(ModelNotTrainedException.class)
                .hasFieldOrPropertyWithValue("component", "learned-model-service");
    }

    @Test
    void train_installsFreshModelEachTime() {
        when(marketDataService.loadRange(FROM, TO)).thenReturn(BarFixtures.series(BarFixtures.wave(300)));

        TrainingReport report = learnedModelService.train(FROM, TO);
        LearnedStrategy first = learnedModelService.requireCurrent();
        learnedModelService.train(FROM, TO);

        assertThat(report.trainingRows()).isPositive();
        assertThat(learnedModelService.requireCurrent()).isNotSameAs(first);
        assertThat(learnedModelService.featureImportances()).isNotEmpty();
    }

    @Test
    void train_keepsPreviousModelWhenFitFails() {
        when(marketDataService.loadRange(FROM, TO))
                .thenReturn(BarFixtures.series(BarFixtures.wave(300)))
                .thenReturn(BarFixtures.series(BarFixtures.wave(60)));
        learnedModelService.train(FROM, TO);
        LearnedStrategy installed = learnedModelService.requireCurrent();

        assertThatThrownBy(() -> learnedModelService.train(FROM, TO)).isInstanceOf(InsufficientHistoryException.class);
        assertThat(learnedModelService.requireCurrent()).isSameAs(installed);
    }
}
