package org.nowstart.spxsignal.backtest;

import java.time.Instant;
import org.nowstart.spxsignal.data.type.ExitReason;
import org.nowstart.spxsignal.data.type.OptionSide;

/**
 * Immutable snapshot of a closed position.
 *
 * @param returnPct premium return, {@code exitPremium / entryPremium - 1}
 */
public record TradeRecord(
        String symbol,
        OptionSide side,
        double strikeReference,
        int quantity,
        Instant entryTime,
        double entryPremium,
        double entryUnderlying,
        double entryConfidence,
        Instant exitTime,
        double exitPremium,
        double exitUnderlying,
        ExitReason exitReason,
        double pnl,
        double returnPct
) {
}
