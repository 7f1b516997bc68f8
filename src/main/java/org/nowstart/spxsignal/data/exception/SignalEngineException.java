package org.nowstart.spxsignal.data.exception;

import java.time.Instant;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class SignalEngineException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final String component;
    private final Instant timestamp;

    public SignalEngineException(HttpStatus status, String code, String component, Instant timestamp, String message) {
        super(message);
        this.status = status;
        this.code = code;
        this.component = component;
        this.timestamp = timestamp;
    }

}
