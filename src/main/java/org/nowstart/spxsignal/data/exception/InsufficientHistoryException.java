package org.nowstart.spxsignal.data.exception;

import java.time.Instant;
import org.springframework.http.HttpStatus;

/**
 * A feature or model needs more bars than the series provides. Strategies degrade this to HOLD.
 */
public class InsufficientHistoryException extends SignalEngineException {

    public InsufficientHistoryException(String component, Instant timestamp, String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "insufficient_history", component, timestamp, message);
    }
}
