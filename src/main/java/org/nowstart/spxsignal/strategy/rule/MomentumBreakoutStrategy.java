package org.nowstart.spxsignal.strategy.rule;

import java.util.List;
import org.nowstart.spxsignal.data.type.SignalType;
import org.nowstart.spxsignal.data.type.StrategyKind;
import org.nowstart.spxsignal.feature.FeatureName;
import org.nowstart.spxsignal.feature.FeatureVector;
import org.nowstart.spxsignal.strategy.core.RuleBasedStrategy;
import org.nowstart.spxsignal.strategy.core.Signal;
import org.nowstart.spxsignal.strategy.core.StrategyDiagnostic;
import org.nowstart.spxsignal.strategy.core.StrategyEvaluation;

/**
 * Trend continuation: price above a rising 20/50 MA stack with strong, directional ADX,
 * MACD above its signal line and confirming volume. Confidence grows with ADX above the threshold.
 */
public class MomentumBreakoutStrategy extends RuleBasedStrategy {

    private final MomentumBreakoutParams params;

    public MomentumBreakoutStrategy(MomentumBreakoutParams params) {
        if (params == null) {
            throw new IllegalArgumentException("params are required");
        }
        this.params = params;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.MOMENTUM_BREAKOUT;
    }

    @Override
    protected StrategyEvaluation decide(FeatureVector features) {
        double close = features.require(FeatureName.CLOSE);
        double sma20 = features.require(FeatureName.SMA_20);
        double sma50 = features.require(FeatureName.SMA_50);
        double adx = features.require(FeatureName.ADX);
        double plusDi = features.require(FeatureName.PLUS_DI);
        double minusDi = features.require(FeatureName.MINUS_DI);
        double macd = features.require(FeatureName.MACD);
        double macdSignal = features.require(FeatureName.MACD_SIGNAL);
        double volumeRatio = features.require(FeatureName.VOLUME_RATIO);

        boolean strongTrend = adx > params.adxThreshold();
        boolean volumeConfirmed = volumeRatio > params.volumeConfirmRatio();
        boolean uptrend = close > sma20 && sma20 > sma50;
        boolean downtrend = close < sma20 && sma20 < sma50;
        boolean bullishMomentum = plusDi > minusDi && macd > macdSignal;
        boolean bearishMomentum = plusDi < minusDi && macd < macdSignal;

        Signal signal;
        if (uptrend && strongTrend && bullishMomentum && volumeConfirmed) {
            signal = new Signal(SignalType.BUY, trendConfidence(adx), name());
        } else if (downtrend && strongTrend && bearishMomentum && volumeConfirmed) {
            signal = new Signal(SignalType.SELL, trendConfidence(adx), name());
        } else {
            signal = Signal.hold(name());
        }

        return new StrategyEvaluation(signal, List.of(
                StrategyDiagnostic.bool("trend.up", "Uptrend", "Close > SMA20 > SMA50", uptrend),
                StrategyDiagnostic.bool("trend.down", "Downtrend", "Close < SMA20 < SMA50", downtrend),
                StrategyDiagnostic.number("adx", "ADX", "", adx),
                StrategyDiagnostic.number("di.spread", "DI Spread", "+DI minus -DI", plusDi - minusDi),
                StrategyDiagnostic.number("macd.spread", "MACD Spread", "MACD minus signal line", macd - macdSignal),
                StrategyDiagnostic.number("volume.ratio", "Volume Ratio", "Volume over 20-bar average", volumeRatio)
        ));
    }

    private double trendConfidence(double adx) {
        double excess = (adx - params.adxThreshold()) / params.adxThreshold();
        return 0.5 + (0.5 * Math.min(1.0, Math.max(0.0, excess)));
    }
}
