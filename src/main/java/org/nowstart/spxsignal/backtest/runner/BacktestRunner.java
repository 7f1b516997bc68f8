package org.nowstart.spxsignal.backtest.runner;

import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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
import org.nowstart.spxsignal.strategy.learned.TrainingReport;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestRunner implements ApplicationRunner {

    private final BacktestProperties config;
    private final StrategyConfig strategyConfig;
    private final MarketDataService marketDataService;
    private final BacktestService backtestService;
    private final ParameterSweepService parameterSweepService;

    @Override
    public void run(ApplicationArguments args) {
        if (!config.enabled()) {
            log.info("backtest.enabled=false; pass --backtest.enabled=true to run");
            return;
        }

        logSection("BACKTEST START");
        log.info("[Overview] from={} to={} trainingRatio={} weights={} topK={} sweepParallelism={}",
                config.fromDt(),
                config.toDt(),
                formatPercent(config.trainingRatio()),
                strategyConfig.namedWeights(),
                config.topK(),
                config.sweepParallelism());

        MarketSeries series = marketDataService.loadRange(config.fromDt(), config.toDt());
        log.info("[Overview] symbol={} loaded bars={} volatilityBars={}",
                series.symbol(), series.size(), series.volatilityBars().size());

        logSection("WALK-FORWARD");
        PreparedRun prepared = backtestService.prepare(series, strategyConfig, config.trainingRatio());
        if (prepared.training() != null) {
            logTraining(prepared.training());
        }
        BacktestResult result = backtestService.execute(prepared, strategyConfig);

        logSection("SUMMARY");
        logSummary("CONFIGURED", result.summary());

        if (config.sweepEnabled()) {
            logSection("PARAMETER SWEEP");
            logSweep(prepared);
        }
        logSection("BACKTEST END");
    }

    private void logTraining(TrainingReport report) {
        log.info("[Learned] trainingRows={} holdoutRows={} holdoutAccuracy={} labels={} trainedThrough={}",
                report.trainingRows(),
                report.holdoutRows(),
                formatPercent(report.holdoutAccuracy()),
                report.labelCounts(),
                report.trainedThrough());
    }

    private void logSummary(String phase, PerformanceSummary summary) {
        log.info("[{}] trades={} wins={} losses={} winRate={} totalReturn={} mdd={} sharpe={} final={} exits={}",
                phase,
                summary.totalTrades(),
                summary.wins(),
                summary.losses(),
                formatPercent(summary.winRate()),
                formatPercent(summary.totalReturn()),
                formatPercent(summary.maxDrawdown()),
                String.format(Locale.US, "%.3f", summary.sharpeRatio()),
                summary.finalCapital(),
                summary.exitsByReason());
    }

    private void logSweep(PreparedRun prepared) {
        log.info("[Overview] combinations={} topK={}", config.combinationCount(), config.topK());
        List<SweepRow> rows = parameterSweepService.sweep(
                prepared,
                strategyConfig,
                config.resolveStopLossValues(),
                config.resolveProfitTargetValues(),
                config.topK(),
                config.sweepParallelism()
        );
        for (int i = 0; i < rows.size(); i++) {
            SweepRow row = rows.get(i);
            log.info("[Candidate {}/{}] stopLoss={} profitTarget={} sharpe={} totalReturn={} mdd={} trades={} final={}",
                    i + 1,
                    rows.size(),
                    row.stopLossPct(),
                    row.profitTargetPct(),
                    String.format(Locale.US, "%.3f", row.sharpeRatio()),
                    formatPercent(row.totalReturn()),
                    formatPercent(row.maxDrawdown()),
                    row.trades(),
                    row.finalCapital());
        }
    }

    private void logSection(String title) {
        log.info("========== {} ==========", title);
    }

    private String formatPercent(double value) {
        if (!Double.isFinite(value)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.2f%%", value * 100.0);
    }
}
