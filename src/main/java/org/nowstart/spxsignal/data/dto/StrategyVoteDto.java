package org.nowstart.spxsignal.data.dto;

import java.util.Map;
import org.nowstart.spxsignal.data.type.SignalType;

public record StrategyVoteDto(
        String strategy,
        double weight,
        SignalType signal,
        double confidence,
        Map<String, Object> diagnostics
) {
}
