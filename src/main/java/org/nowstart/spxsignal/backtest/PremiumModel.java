package org.nowstart.spxsignal.backtest;

import org.nowstart.spxsignal.data.type.OptionSide;

/**
 * Option-proxy premium: a fixed fraction of the underlying at entry, then marked by a leveraged
 * directional return of the underlying and floored at zero.
 */
public final class PremiumModel {

    private final OptionProxyParams params;

    public PremiumModel(OptionProxyParams params) {
        if (params == null) {
            throw new IllegalArgumentException("option proxy params are required");
        }
        this.params = params;
    }

    public double entryPremium(double underlyingClose) {
        return underlyingClose * params.premiumRatio();
    }

    public double strikeReference(double underlyingClose, OptionSide side) {
        return side == OptionSide.CALL
                ? underlyingClose * (1.0 + params.strikeOffsetPct())
                : underlyingClose * (1.0 - params.strikeOffsetPct());
    }

    public double mark(double entryPremium, double entryUnderlying, double underlying, OptionSide side) {
        double underlyingReturn = underlying / entryUnderlying - 1.0;
        double directional = side == OptionSide.CALL ? underlyingReturn : -underlyingReturn;
        return entryPremium * Math.max(0.0, 1.0 + params.leverage() * directional);
    }

    public int contractMultiplier() {
        return params.contractMultiplier();
    }
}
