package org.nowstart.spxsignal.backtest.runner;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.spxsignal.backtest.BacktestResult;
import org.nowstart.spxsignal.backtest.PreparedRun;
import org.nowstart.spxsignal.backtest.sweep.ParameterSweepService;
import org.nowstart.spxsignal.backtest.sweep.SweepRow;
import org.nowstart.spxsignal.data.property.BacktestProperties;
import org.nowstart.spxsignal.market.MarketSeries;
import org.nowstart.spxsignal.report.PerformanceSummary;
import org.nowstart.spxsignal.service.BacktestService;
import org.nowstart.spxsignal.service.MarketDataService;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.nowstart.spxsignal.support.BarFixtures;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class BacktestRunnerTest {

    private static final Instant FROM = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2024-06-01T00:00:00Z");

    private final StrategyConfig strategyConfig = StrategyConfig.defaults();

    @Mock
    private MarketDataService marketDataService;

    @Mock
    private BacktestService backtestService;

    @Mock
    private ParameterSweepService parameterSweepService;

    @Test
    void run_doesNothingWhenDisabled() {
        runner(new BacktestProperties(false, FROM, TO, null, null, null, null, null, null))
                .run(new DefaultApplicationArguments());

        verifyNoInteractions(marketDataService, backtestService, parameterSweepService);
    }

    @Test
    void run_executesConfiguredWalkForwardWithoutSweep() {
        PreparedRun prepared = stubWalkForward();

        runner(new BacktestProperties(true, FROM, TO, 0.7, false, null, null, 3, 1))
                .run(new DefaultApplicationArguments());

        verify(backtestService).execute(prepared, strategyConfig);
        verifyNoInteractions(parameterSweepService);
    }

    @Test
    void run_sweepsConfiguredGrid() {
        PreparedRun prepared = stubWalkForward();
        when(parameterSweepService.sweep(eq(prepared), eq(strategyConfig), any(), any(), eq(3), eq(2)))
                .thenReturn(List.of(new SweepRow(0.4, 0.25, 1.2, 0.1, 0.05, 7, 110_000.0)));

        runner(new BacktestProperties(true, FROM, TO, 0.7, true, "0.3:0.5:0.1", "0.15:0.25:0.1", 3, 2))
                .run(new DefaultApplicationArguments());

        verify(parameterSweepService).sweep(
                prepared, strategyConfig, List.of(0.3, 0.4, 0.5), List.of(0.15, 0.25), 3, 2);
    }

    private PreparedRun stubWalkForward() {
        MarketSeries series = BarFixtures.series(BarFixtures.flat(10, 100.0));
        PreparedRun prepared = new PreparedRun("SPX", BarFixtures.features(BarFixtures.flat(10, 100.0)), 0, null, null);
        PerformanceSummary summary = PerformanceSummary.builder().initialCapital(100_000.0).finalCapital(100_000.0).build();
        when(marketDataService.loadRange(FROM, TO)).thenReturn(series);
        when(backtestService.prepare(series, strategyConfig, 0.7)).thenReturn(prepared);
        when(backtestService.execute(prepared, strategyConfig))
                .thenReturn(new BacktestResult("SPX", strategyConfig, List.of(), List.of(), summary, null));
        return prepared;
    }

    private BacktestRunner runner(BacktestProperties properties) {
        return new BacktestRunner(properties, strategyConfig, marketDataService, backtestService, parameterSweepService);
    }
}
