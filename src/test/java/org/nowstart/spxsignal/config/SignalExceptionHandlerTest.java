package org.nowstart.spxsignal.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.nowstart.spxsignal.data.exception.InsufficientHistoryException;
import org.nowstart.spxsignal.data.exception.InvalidConfigurationException;
import org.nowstart.spxsignal.data.exception.ModelNotTrainedException;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

class SignalExceptionHandlerTest {

    private final SignalExceptionHandler handler = new SignalExceptionHandler();

    @Test
    void handleSignalEngineException_returnsProblemDetailWithCodeAndComponent() {
        Instant timestamp = Instant.parse("2024-03-01T00:00:00Z");
        InsufficientHistoryException exception = new InsufficientHistoryException("backtest", timestamp, "Not enough bars");

        ProblemDetail detail = handler.handleSignalEngineException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY.value());
        assertThat(detail.getDetail()).isEqualTo("Not enough bars");
        assertThat(detail.getProperties())
                .containsEntry("code", "insufficient_history")
                .containsEntry("component", "backtest")
                .containsEntry("timestamp", "2024-03-01T00:00:00Z");
    }

    @Test
    void handleSignalEngineException_mapsUntrainedModelToConflict() {
        ProblemDetail detail = handler.handleSignalEngineException(new ModelNotTrainedException("learned-model-service", null));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.CONFLICT.value());
        assertThat(detail.getProperties())
                .containsEntry("code", "model_not_trained")
                .doesNotContainKey("timestamp");
    }

    @Test
    void handleSignalEngineException_mapsInvalidConfigurationToBadRequest() {
        ProblemDetail detail = handler.handleSignalEngineException(new InvalidConfigurationException("weights must sum to 1"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties()).containsEntry("code", "invalid_configuration");
    }

    @Test
    void handleUnexpectedException_returnsInternalErrorProblemDetail() {
        ProblemDetail detail = handler.handleUnexpectedException(new IllegalStateException("boom"));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
        assertThat(detail.getDetail()).isEqualTo("Unexpected server error");
        assertThat(detail.getProperties()).containsEntry("code", "internal_error");
    }

    @Test
    void handleValidationException_returnsValidationDetails() throws NoSuchMethodException {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new ValidationTarget(), "target");
        bindingResult.addError(new FieldError("target", "from", "from is required"));
        MethodParameter methodParameter = new MethodParameter(
                SignalExceptionHandlerTest.class.getDeclaredMethod("dummyValidationMethod", ValidationTarget.class),
                0
        );
        MethodArgumentNotValidException exception = new MethodArgumentNotValidException(methodParameter, bindingResult);

        ProblemDetail detail = handler.handleValidationException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getDetail()).isEqualTo("Request validation failed");
        assertThat(detail.getProperties()).containsEntry("code", "validation_error");
        assertThat(detail.getProperties()).containsEntry("details", List.of("from is required"));
    }

    @Test
    void handleConstraintViolationException_returnsValidationDetails() {
        @SuppressWarnings("unchecked")
        ConstraintViolation<Object> violation = (ConstraintViolation<Object>) mock(ConstraintViolation.class);
        when(violation.getMessage()).thenReturn("trainingRatio must be less than 1");

        ProblemDetail detail = handler.handleConstraintViolationException(new ConstraintViolationException(Set.of(violation)));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties()).containsEntry("code", "validation_error");
        assertThat(detail.getProperties()).containsEntry("details", List.of("trainingRatio must be less than 1"));
    }

    @SuppressWarnings("unused")
    private void dummyValidationMethod(ValidationTarget target) {
    }

    private static final class ValidationTarget {
        private Instant from;
    }
}
