package org.nowstart.spxsignal.data.type;

import java.util.Locale;

public enum StrategyKind {
    MEAN_REVERSION("mean_reversion"),
    MOMENTUM_BREAKOUT("momentum_breakout"),
    VOLATILITY_BREAKOUT("volatility_breakout"),
    LEARNED("learned");

    private final String key;

    StrategyKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static StrategyKind fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("strategy name is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (StrategyKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown strategy name=" + raw);
    }
}
