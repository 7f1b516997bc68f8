package org.nowstart.spxsignal.backtest;

import java.time.Instant;

/**
 * Capital after processing one bar. {@code capital} moves only on closes; {@code unrealizedPnl}
 * is the open position's mark at the bar close.
 */
public record CapitalPoint(
        Instant timestamp,
        double capital,
        double unrealizedPnl
) {
}
