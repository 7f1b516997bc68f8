package org.nowstart.spxsignal.backtest;

/**
 * Contracts for a new position, sized so the loss at the stop stays within the per-trade and portfolio
 * risk budgets and the premium outlay stays within capital.
 */
public final class PositionSizer {

    private final RiskLimits limits;
    private final int contractMultiplier;

    public PositionSizer(RiskLimits limits, int contractMultiplier) {
        this.limits = limits;
        this.contractMultiplier = contractMultiplier;
    }

    /**
     * The engine holds at most one position, so the portfolio budget applies to the new position alone.
     */
    public int quantity(double capital, double premium) {
        if (!(capital > 0.0) || !(premium > 0.0)) {
            return 0;
        }
        double stopDistance = premium * limits.stopLossPct() * contractMultiplier;
        double byTradeRisk = limits.maxRiskPerTrade() * capital / stopDistance;
        double byPortfolioRisk = limits.maxPortfolioRisk() * capital / stopDistance;
        double byCash = capital / (premium * contractMultiplier);
        double raw = Math.min(Math.min(byTradeRisk, byPortfolioRisk), Math.min(byCash, limits.maxPositionSize()));
        return (int) Math.floor(raw);
    }
}
