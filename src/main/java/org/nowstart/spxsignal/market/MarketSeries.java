package org.nowstart.spxsignal.market;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Underlying bars plus the auxiliary volatility-index bars for one symbol and date range.
 */
public record MarketSeries(
        String symbol,
        List<Bar> bars,
        List<Bar> volatilityBars
) {

    public MarketSeries {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        bars = List.copyOf(bars == null ? List.of() : bars);
        volatilityBars = List.copyOf(volatilityBars == null ? List.of() : volatilityBars);
        TimeSeriesValidator.requireStrictlyIncreasing(bars, "market-series:" + symbol);
        TimeSeriesValidator.requireStrictlyIncreasing(volatilityBars, "market-series:" + symbol + ":volatility");
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    /**
     * Volatility-index close aligned to each underlying bar by exact timestamp, NaN where absent.
     */
    public double[] alignedVolatilityClose() {
        Map<Instant, Double> byTimestamp = new HashMap<>(volatilityBars.size() * 2);
        for (Bar bar : volatilityBars) {
            byTimestamp.put(bar.timestamp(), bar.close());
        }
        double[] aligned = new double[bars.size()];
        Arrays.fill(aligned, Double.NaN);
        for (int i = 0; i < bars.size(); i++) {
            Double value = byTimestamp.get(bars.get(i).timestamp());
            if (value != null) {
                aligned[i] = value;
            }
        }
        return aligned;
    }
}
