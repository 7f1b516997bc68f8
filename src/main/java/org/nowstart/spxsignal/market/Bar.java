package org.nowstart.spxsignal.market;

import java.time.Instant;

public record Bar(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume
) {

    public Bar {
        if (timestamp == null) {
            throw new IllegalArgumentException("bar timestamp is required");
        }
    }
}
