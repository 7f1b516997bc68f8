package org.nowstart.spxsignal.data.exception;

import java.time.Instant;
import org.springframework.http.HttpStatus;

public class NonMonotonicTimeSeriesException extends SignalEngineException {

    public NonMonotonicTimeSeriesException(String component, Instant timestamp, String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "non_monotonic_series", component, timestamp, message);
    }
}
