package org.nowstart.spxsignal.data.dto;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.time.Instant;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class RequestValidationTest {

    private static final Instant EARLY = Instant.parse("2020-01-01T00:00:00Z");
    private static final Instant LATE = Instant.parse("2024-01-01T00:00:00Z");

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void backtestRequest_rejectsReversedRange() {
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(new BacktestRequest(LATE, EARLY, null));

        assertThat(violations).extracting(ConstraintViolation::getMessage).containsExactly("from must be <= to");
        assertThat(violations).extracting(violation -> violation.getPropertyPath().toString())
                .containsExactly("rangeOrdered");
    }

    @Test
    void backtestRequest_acceptsOrderedRange() {
        assertThat(validator.validate(new BacktestRequest(EARLY, LATE, 0.7))).isEmpty();
        assertThat(validator.validate(new BacktestRequest(EARLY, EARLY, null))).isEmpty();
    }

    @Test
    void backtestRequest_reportsMissingBoundsWithoutRangeError() {
        Set<ConstraintViolation<BacktestRequest>> violations = validator.validate(new BacktestRequest(null, EARLY, null));

        assertThat(violations).extracting(ConstraintViolation::getMessage).containsExactly("from is required");
    }

    @Test
    void modelTrainRequest_rejectsReversedRange() {
        Set<ConstraintViolation<ModelTrainRequest>> violations = validator.validate(new ModelTrainRequest(LATE, EARLY));

        assertThat(violations).extracting(ConstraintViolation::getMessage).containsExactly("from must be <= to");
    }
}
