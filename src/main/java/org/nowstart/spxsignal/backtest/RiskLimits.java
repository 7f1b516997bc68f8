package org.nowstart.spxsignal.backtest;

import org.nowstart.spxsignal.data.exception.InvalidConfigurationException;

/**
 * @param maxHoldingDays  calendar days after which an open position expires (DTE analogue)
 * @param maxPositionSize upper bound on contracts per position
 */
public record RiskLimits(
        double maxRiskPerTrade,
        double maxPortfolioRisk,
        double stopLossPct,
        double profitTargetPct,
        int maxHoldingDays,
        int maxPositionSize
) {

    public static final RiskLimits DEFAULTS = new RiskLimits(0.02, 0.10, 0.50, 0.25, 30, 100);

    public RiskLimits {
        requireFraction(maxRiskPerTrade, "max-risk-per-trade");
        requireFraction(maxPortfolioRisk, "max-portfolio-risk");
        requireFraction(stopLossPct, "stop-loss-pct");
        if (!(profitTargetPct > 0.0) || !Double.isFinite(profitTargetPct)) {
            throw new InvalidConfigurationException("profit-target-pct must be > 0");
        }
        if (maxHoldingDays <= 0) {
            throw new InvalidConfigurationException("max-holding-days must be > 0");
        }
        if (maxPositionSize <= 0) {
            throw new InvalidConfigurationException("max-position-size must be > 0");
        }
    }

    public RiskLimits withExits(double stopLoss, double profitTarget) {
        return new RiskLimits(maxRiskPerTrade, maxPortfolioRisk, stopLoss, profitTarget, maxHoldingDays, maxPositionSize);
    }

    private static void requireFraction(double value, String name) {
        if (!(value > 0.0 && value <= 1.0)) {
            throw new InvalidConfigurationException(name + " must be in (0, 1], got " + value);
        }
    }
}
