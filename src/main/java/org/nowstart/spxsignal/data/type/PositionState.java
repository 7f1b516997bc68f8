package org.nowstart.spxsignal.data.type;

public enum PositionState {
    OPEN,
    CLOSED
}
