package org.nowstart.spxsignal.data.exception;

import java.time.Instant;
import org.springframework.http.HttpStatus;

public class ModelNotTrainedException extends SignalEngineException {

    public ModelNotTrainedException(String component, Instant timestamp) {
        super(HttpStatus.CONFLICT, "model_not_trained", component, timestamp,
                "Learned strategy must be trained before prediction");
    }
}
