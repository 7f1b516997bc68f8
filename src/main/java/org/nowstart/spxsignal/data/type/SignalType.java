package org.nowstart.spxsignal.data.type;

public enum SignalType {
    BUY,
    SELL,
    HOLD;

    public boolean isActionable() {
        return this != HOLD;
    }

    public SignalType opposite() {
        return switch (this) {
            case BUY -> SELL;
            case SELL -> BUY;
            case HOLD -> HOLD;
        };
    }
}
