package org.nowstart.spxsignal.service;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.nowstart.spxsignal.data.property.MarketDataProperties;
import org.nowstart.spxsignal.market.MarketDataProvider;
import org.nowstart.spxsignal.market.MarketSeries;
import org.springframework.stereotype.Service;

/**
 * Loads the configured underlying together with its volatility index.
 */
@Service
@RequiredArgsConstructor
public class MarketDataService {

    private final MarketDataProvider marketDataProvider;
    private final MarketDataProperties marketDataProperties;

    public MarketSeries loadRange(Instant from, Instant to) {
        return marketDataProvider.load(marketDataProperties.symbol(), from, to);
    }

    public MarketSeries loadLatest() {
        return marketDataProvider.loadLatest(marketDataProperties.symbol(), marketDataProperties.liveLookbackBars());
    }
}
