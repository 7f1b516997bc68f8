package org.nowstart.spxsignal.backtest.sweep;

public record SweepRow(
        double stopLossPct,
        double profitTargetPct,
        double sharpeRatio,
        double totalReturn,
        double maxDrawdown,
        int trades,
        double finalCapital
) {
}
