package org.nowstart.spxsignal.backtest;

import java.util.List;
import org.nowstart.spxsignal.report.PerformanceSummary;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.nowstart.spxsignal.strategy.learned.TrainingReport;

/**
 * Output of one run: every closed trade, the per-bar capital series and the summary metrics.
 *
 * @param training learned-model fit used by the run, null when the learned strategy carried no weight
 */
public record BacktestResult(
        String symbol,
        StrategyConfig config,
        List<TradeRecord> trades,
        List<CapitalPoint> capitalSeries,
        PerformanceSummary summary,
        TrainingReport training
) {

    public BacktestResult {
        trades = trades == null ? List.of() : List.copyOf(trades);
        capitalSeries = capitalSeries == null ? List.of() : List.copyOf(capitalSeries);
    }

    public BacktestResult withTraining(TrainingReport report) {
        return new BacktestResult(symbol, config, trades, capitalSeries, summary, report);
    }

    public double finalCapital() {
        return summary.finalCapital();
    }
}
