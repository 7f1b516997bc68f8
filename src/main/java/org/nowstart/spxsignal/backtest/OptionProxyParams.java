package org.nowstart.spxsignal.backtest;

import org.nowstart.spxsignal.data.exception.InvalidConfigurationException;

/**
 * Simple premium tracking for the option proxy.
 *
 * @param premiumRatio       entry premium as a fraction of the underlying close
 * @param leverage           premium sensitivity to the directional underlying return
 * @param strikeOffsetPct    strike distance from the underlying, out of the money
 * @param contractMultiplier underlying units per contract
 */
public record OptionProxyParams(
        double premiumRatio,
        double leverage,
        double strikeOffsetPct,
        int contractMultiplier
) {

    public static final OptionProxyParams DEFAULTS = new OptionProxyParams(0.03, 10.0, 0.02, 100);

    public OptionProxyParams {
        if (!(premiumRatio > 0.0 && premiumRatio < 1.0)) {
            throw new InvalidConfigurationException("premium-ratio must be in (0, 1)");
        }
        if (!(leverage > 0.0) || !Double.isFinite(leverage)) {
            throw new InvalidConfigurationException("leverage must be > 0");
        }
        if (strikeOffsetPct < 0.0 || strikeOffsetPct >= 1.0) {
            throw new InvalidConfigurationException("strike-offset-pct must be in [0, 1)");
        }
        if (contractMultiplier <= 0) {
            throw new InvalidConfigurationException("contract-multiplier must be > 0");
        }
    }
}
