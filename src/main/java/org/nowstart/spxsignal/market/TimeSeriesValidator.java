package org.nowstart.spxsignal.market;

import java.time.Instant;
import java.util.List;
import org.nowstart.spxsignal.data.exception.NonMonotonicTimeSeriesException;

public final class TimeSeriesValidator {

    private TimeSeriesValidator() {
    }

    /**
     * Rejects the whole series on the first timestamp that does not strictly increase.
     */
    public static void requireStrictlyIncreasing(List<Bar> bars, String component) {
        if (bars == null) {
            throw new IllegalArgumentException("bars are required");
        }
        Instant previous = null;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null) {
                throw new IllegalArgumentException("bar at index " + i + " is null");
            }
            if (previous != null && !bar.timestamp().isAfter(previous)) {
                throw new NonMonotonicTimeSeriesException(
                        component,
                        bar.timestamp(),
                        "Timestamp at index " + i + " (" + bar.timestamp() + ") is not after previous " + previous
                );
            }
            previous = bar.timestamp();
        }
    }
}
