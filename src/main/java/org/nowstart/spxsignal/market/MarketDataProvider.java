package org.nowstart.spxsignal.market;

import java.time.Instant;

/**
 * Supplies ordered bars for the underlying and its volatility index.
 */
public interface MarketDataProvider {

    MarketSeries load(String symbol, Instant fromInclusive, Instant toInclusive);

    /**
     * Returns the most recent {@code count} bars available for the symbol.
     */
    MarketSeries loadLatest(String symbol, int count);
}
