package org.nowstart.spxsignal.report;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.spxsignal.backtest.CapitalPoint;
import org.nowstart.spxsignal.backtest.TradeRecord;
import org.nowstart.spxsignal.data.property.ReportProperties;
import org.nowstart.spxsignal.data.type.ExitReason;
import org.springframework.stereotype.Component;

/**
 * Pure aggregation over closed trades and the capital series.
 */
@Component
@RequiredArgsConstructor
public class PerformanceReporter {

    private final ReportProperties properties;

    public PerformanceSummary summarize(double initialCapital, List<TradeRecord> trades, List<CapitalPoint> capitalSeries) {
        int wins = 0;
        int losses = 0;
        double grossProfit = 0.0;
        double grossLoss = 0.0;
        Map<ExitReason, Integer> exits = new EnumMap<>(ExitReason.class);
        for (TradeRecord trade : trades) {
            if (trade.pnl() > 0.0) {
                wins++;
                grossProfit += trade.pnl();
            } else if (trade.pnl() < 0.0) {
                losses++;
                grossLoss += -trade.pnl();
            }
            exits.merge(trade.exitReason(), 1, Integer::sum);
        }

        int total = trades.size();
        double finalCapital = capitalSeries.isEmpty()
                ? initialCapital + grossProfit - grossLoss
                : capitalSeries.get(capitalSeries.size() - 1).capital();

        return PerformanceSummary.builder()
                .totalTrades(total)
                .wins(wins)
                .losses(losses)
                .winRate(total == 0 ? 0.0 : wins / (double) total)
                .totalPnl(grossProfit - grossLoss)
                .averageWin(wins == 0 ? 0.0 : grossProfit / wins)
                .averageLoss(losses == 0 ? 0.0 : -grossLoss / losses)
                .profitFactor(profitFactor(grossProfit, grossLoss))
                .initialCapital(initialCapital)
                .finalCapital(finalCapital)
                .totalReturn(initialCapital > 0.0 ? finalCapital / initialCapital - 1.0 : 0.0)
                .maxDrawdown(maxDrawdown(initialCapital, capitalSeries))
                .sharpeRatio(sharpeRatio(initialCapital, capitalSeries))
                .exitsByReason(exits)
                .build();
    }

    double maxDrawdown(double initialCapital, List<CapitalPoint> capitalSeries) {
        double peak = initialCapital;
        double worst = 0.0;
        for (CapitalPoint point : capitalSeries) {
            peak = Math.max(peak, point.capital());
            if (peak > 0.0) {
                worst = Math.max(worst, 1.0 - point.capital() / peak);
            }
        }
        return worst;
    }

    /**
     * Annualized Sharpe of per-period capital returns; 0 when there are fewer than two returns or no variance.
     */
    double sharpeRatio(double initialCapital, List<CapitalPoint> capitalSeries) {
        int n = capitalSeries.size();
        if (n < 2) {
            return 0.0;
        }
        double[] returns = new double[n];
        double previous = initialCapital;
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            double current = capitalSeries.get(i).capital();
            returns[i] = previous > 0.0 ? current / previous - 1.0 : 0.0;
            sum += returns[i];
            previous = current;
        }
        double mean = sum / n;
        double variance = 0.0;
        for (double value : returns) {
            variance += (value - mean) * (value - mean);
        }
        double std = Math.sqrt(variance / (n - 1));
        if (std <= 1e-15) {
            return 0.0;
        }
        double periodRiskFree = properties.riskFreeRate() / properties.periodsPerYear();
        return (mean - periodRiskFree) / std * Math.sqrt(properties.periodsPerYear());
    }

    private double profitFactor(double grossProfit, double grossLoss) {
        if (grossLoss == 0.0) {
            return grossProfit > 0.0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return grossProfit / grossLoss;
    }
}
