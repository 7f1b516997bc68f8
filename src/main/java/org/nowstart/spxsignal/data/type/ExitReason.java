package org.nowstart.spxsignal.data.type;

/**
 * Close triggers in precedence order: when several fire on the same bar the first one wins.
 */
public enum ExitReason {
    STOP_LOSS,
    PROFIT_TARGET,
    SIGNAL_REVERSAL,
    EXPIRY,
    END_OF_DATA
}
