package org.nowstart.spxsignal.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

public record ModelTrainRequest(
        @NotNull(message = "from is required")
        Instant from,
        @NotNull(message = "to is required")
        Instant to
) {

    @JsonIgnore
    @AssertTrue(message = "from must be <= to")
    public boolean isRangeOrdered() {
        return from == null || to == null || !from.isAfter(to);
    }
}
