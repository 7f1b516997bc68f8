package org.nowstart.spxsignal.strategy.rule;

import java.util.List;
import java.util.OptionalDouble;
import org.nowstart.spxsignal.data.type.SignalType;
import org.nowstart.spxsignal.data.type.StrategyKind;
import org.nowstart.spxsignal.feature.FeatureName;
import org.nowstart.spxsignal.feature.FeatureVector;
import org.nowstart.spxsignal.strategy.core.RuleBasedStrategy;
import org.nowstart.spxsignal.strategy.core.Signal;
import org.nowstart.spxsignal.strategy.core.StrategyDiagnostic;
import org.nowstart.spxsignal.strategy.core.StrategyEvaluation;

/**
 * Oversold/overbought fade. RSI, band position, Williams %R and a volume spike must all agree;
 * a low-volatility regime (ATR under its average) raises confidence but is not required.
 */
public class MeanReversionStrategy extends RuleBasedStrategy {

    private static final int SUB_CONDITIONS = 5;

    private final MeanReversionParams params;

    public MeanReversionStrategy(MeanReversionParams params) {
        if (params == null) {
            throw new IllegalArgumentException("params are required");
        }
        this.params = params;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.MEAN_REVERSION;
    }

    @Override
    protected StrategyEvaluation decide(FeatureVector features) {
        double rsi = features.require(FeatureName.RSI_14);
        double bandPosition = features.require(FeatureName.BB_POSITION);
        double williams = features.require(FeatureName.WILLIAMS_R);
        double volumeRatio = features.require(FeatureName.VOLUME_RATIO);

        OptionalDouble atr = features.get(FeatureName.ATR);
        OptionalDouble atrAverage = features.get(FeatureName.ATR_AVG);
        boolean lowVolatility = atr.isPresent() && atrAverage.isPresent()
                && atr.getAsDouble() < atrAverage.getAsDouble();
        boolean volumeSpike = volumeRatio > params.volumeSpikeRatio();

        boolean rsiOversold = rsi < params.rsiOversold();
        boolean bandLow = bandPosition < params.bandPositionLow();
        boolean williamsOversold = williams < params.williamsOversold();

        boolean rsiOverbought = rsi > params.rsiOverbought();
        boolean bandHigh = bandPosition > params.bandPositionHigh();
        boolean williamsOverbought = williams > params.williamsOverbought();

        // low volatility adds confidence but does not gate the signal
        int buyCount = count(rsiOversold, bandLow, williamsOversold, volumeSpike, lowVolatility);
        int sellCount = count(rsiOverbought, bandHigh, williamsOverbought, volumeSpike, lowVolatility);

        Signal signal;
        if (rsiOversold && bandLow && williamsOversold && volumeSpike) {
            signal = new Signal(SignalType.BUY, fraction(buyCount, SUB_CONDITIONS), name());
        } else if (rsiOverbought && bandHigh && williamsOverbought && volumeSpike) {
            signal = new Signal(SignalType.SELL, fraction(sellCount, SUB_CONDITIONS), name());
        } else {
            signal = Signal.hold(name());
        }

        return new StrategyEvaluation(signal, List.of(
                StrategyDiagnostic.number("rsi", "RSI(14)", "", rsi),
                StrategyDiagnostic.number("bb.position", "Band Position", "Close position inside Bollinger band", bandPosition),
                StrategyDiagnostic.number("williams_r", "Williams %R", "", williams),
                StrategyDiagnostic.number("volume.ratio", "Volume Ratio", "Volume over 20-bar average", volumeRatio),
                StrategyDiagnostic.bool("volatility.low", "Low Volatility", "ATR below its rolling average", lowVolatility),
                StrategyDiagnostic.number("conditions.buy", "Buy Conditions", "Satisfied oversold sub-conditions", buyCount),
                StrategyDiagnostic.number("conditions.sell", "Sell Conditions", "Satisfied overbought sub-conditions", sellCount)
        ));
    }
}
