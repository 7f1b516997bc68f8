package org.nowstart.spxsignal.data.type;

public enum OptionSide {
    CALL,
    PUT;

    public static OptionSide forSignal(SignalType signal) {
        return switch (signal) {
            case BUY -> CALL;
            case SELL -> PUT;
            case HOLD -> throw new IllegalArgumentException("HOLD does not map to an option side");
        };
    }

    /**
     * Signal that would close a position of this side by reversal.
     */
    public SignalType opposingSignal() {
        return this == CALL ? SignalType.SELL : SignalType.BUY;
    }
}
