package org.nowstart.spxsignal.data.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.nowstart.spxsignal.data.type.OptionSide;
import org.nowstart.spxsignal.data.type.SignalType;

/**
 * Live query result for the most recent bar.
 *
 * @param optionSide    CALL for BUY, PUT for SELL, null for HOLD
 * @param keyIndicators price, RSI, MACD, volatility index and percent distance from SMA20 where available
 */
public record RecommendationDto(
        String symbol,
        Instant timestamp,
        SignalType signal,
        double confidence,
        OptionSide optionSide,
        String recommendation,
        Map<String, Double> keyIndicators,
        List<StrategyVoteDto> votes
) {
}
