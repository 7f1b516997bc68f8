package org.nowstart.spxsignal.data.exception;

import org.springframework.http.HttpStatus;

public class InvalidConfigurationException extends SignalEngineException {

    public InvalidConfigurationException(String message) {
        super(HttpStatus.BAD_REQUEST, "invalid_configuration", "configuration", null, message);
    }
}
