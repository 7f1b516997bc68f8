package org.nowstart.spxsignal.report;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import lombok.Builder;
import org.nowstart.spxsignal.data.type.ExitReason;

/**
 * Summary metrics of one run. Every field is defined when no trade occurred.
 *
 * @param maxDrawdown  largest peak-to-trough capital decline as a positive fraction
 * @param profitFactor gross profit over gross loss; infinite when winners exist without losers
 */
@Builder
public record PerformanceSummary(
        int totalTrades,
        int wins,
        int losses,
        double winRate,
        double totalPnl,
        double averageWin,
        double averageLoss,
        double profitFactor,
        double initialCapital,
        double finalCapital,
        double totalReturn,
        double maxDrawdown,
        double sharpeRatio,
        Map<ExitReason, Integer> exitsByReason
) {

    public PerformanceSummary {
        exitsByReason = exitsByReason == null || exitsByReason.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(exitsByReason));
    }
}
