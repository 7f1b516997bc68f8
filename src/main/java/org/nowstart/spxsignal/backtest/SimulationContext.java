package org.nowstart.spxsignal.backtest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.nowstart.spxsignal.data.type.ExitReason;

/**
 * Mutable state of exactly one backtest run: capital, the open position, closed trades and the capital
 * series. Created per run and never shared, so independent runs can execute in parallel.
 */
public final class SimulationContext {

    private final String symbol;
    private final double initialCapital;
    private final List<TradeRecord> trades = new ArrayList<>();
    private final List<CapitalPoint> capitalSeries = new ArrayList<>();
    private double capital;
    private Position openPosition;

    public SimulationContext(String symbol, double initialCapital) {
        this.symbol = symbol;
        this.initialCapital = initialCapital;
        this.capital = initialCapital;
    }

    public String symbol() {
        return symbol;
    }

    public double initialCapital() {
        return initialCapital;
    }

    public double capital() {
        return capital;
    }

    public boolean isFlat() {
        return openPosition == null;
    }

    public Optional<Position> openPosition() {
        return Optional.ofNullable(openPosition);
    }

    void open(Position position) {
        if (openPosition != null) {
            throw new IllegalStateException("position already open for " + symbol);
        }
        this.openPosition = position;
    }

    TradeRecord close(double exitPremium, double exitUnderlying, Instant time, ExitReason reason) {
        if (openPosition == null) {
            throw new IllegalStateException("no open position for " + symbol);
        }
        TradeRecord trade = openPosition.close(exitPremium, exitUnderlying, time, reason);
        capital += trade.pnl();
        trades.add(trade);
        openPosition = null;
        return trade;
    }

    void recordCapital(Instant timestamp) {
        double unrealized = openPosition == null ? 0.0 : openPosition.unrealizedPnl();
        capitalSeries.add(new CapitalPoint(timestamp, capital, unrealized));
    }

    public List<TradeRecord> trades() {
        return List.copyOf(trades);
    }

    public List<CapitalPoint> capitalSeries() {
        return List.copyOf(capitalSeries);
    }
}
