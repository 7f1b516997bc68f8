package org.nowstart.spxsignal.backtest;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import org.nowstart.spxsignal.data.type.ExitReason;
import org.nowstart.spxsignal.data.type.OptionSide;
import org.nowstart.spxsignal.data.type.PositionState;

/**
 * Option-proxy position. Moves OPEN to CLOSED exactly once; P&amp;L is always derived from the
 * entry/exit premiums and quantity.
 */
@Getter
public class Position {

    private final String symbol;
    private final OptionSide side;
    private final double strikeReference;
    private final int quantity;
    private final int contractMultiplier;
    private final double entryPremium;
    private final double entryUnderlying;
    private final double entryConfidence;
    private final Instant entryTime;
    private PositionState state;
    private double markPremium;
    private Double exitPremium;
    private Double exitUnderlying;
    private Instant exitTime;
    private ExitReason exitReason;

    @Builder
    private Position(
            String symbol,
            OptionSide side,
            double strikeReference,
            int quantity,
            int contractMultiplier,
            double entryPremium,
            double entryUnderlying,
            double entryConfidence,
            Instant entryTime
    ) {
        if (side == null || entryTime == null) {
            throw new IllegalArgumentException("side and entryTime are required");
        }
        if (quantity <= 0 || contractMultiplier <= 0 || !(entryPremium > 0.0)) {
            throw new IllegalArgumentException("quantity, multiplier and entry premium must be positive");
        }
        this.symbol = symbol;
        this.side = side;
        this.strikeReference = strikeReference;
        this.quantity = quantity;
        this.contractMultiplier = contractMultiplier;
        this.entryPremium = entryPremium;
        this.entryUnderlying = entryUnderlying;
        this.entryConfidence = entryConfidence;
        this.entryTime = entryTime;
        this.state = PositionState.OPEN;
        this.markPremium = entryPremium;
    }

    public boolean isOpen() {
        return state == PositionState.OPEN;
    }

    public void markTo(double premium) {
        requireOpen();
        this.markPremium = premium;
    }

    public double unrealizedPnl() {
        return isOpen() ? pnlAt(markPremium) : 0.0;
    }

    public double realizedPnl() {
        return exitPremium == null ? 0.0 : pnlAt(exitPremium);
    }

    public long daysHeld(Instant now) {
        return Duration.between(entryTime, now).toDays();
    }

    TradeRecord close(double premium, double underlying, Instant time, ExitReason reason) {
        requireOpen();
        this.exitPremium = premium;
        this.exitUnderlying = underlying;
        this.exitTime = time;
        this.exitReason = reason;
        this.markPremium = premium;
        this.state = PositionState.CLOSED;
        return new TradeRecord(
                symbol,
                side,
                strikeReference,
                quantity,
                entryTime,
                entryPremium,
                entryUnderlying,
                entryConfidence,
                time,
                premium,
                underlying,
                reason,
                realizedPnl(),
                premium / entryPremium - 1.0
        );
    }

    private double pnlAt(double premium) {
        return (premium - entryPremium) * quantity * contractMultiplier;
    }

    private void requireOpen() {
        if (!isOpen()) {
            throw new IllegalStateException("position is already closed");
        }
    }
}
