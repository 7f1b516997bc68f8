package org.nowstart.spxsignal.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

public record BacktestRequest(
        @NotNull(message = "from is required")
        Instant from,
        @NotNull(message = "to is required")
        Instant to,
        // share of bars used to train the learned strategy; defaults to backtest.training-ratio
        @DecimalMin(value = "0", inclusive = false, message = "trainingRatio must be > 0")
        @DecimalMax(value = "1", inclusive = false, message = "trainingRatio must be < 1")
        Double trainingRatio
) {

    @JsonIgnore
    @AssertTrue(message = "from must be <= to")
    public boolean isRangeOrdered() {
        return from == null || to == null || !from.isAfter(to);
    }
}
