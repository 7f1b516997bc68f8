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
 * Close outside the Bollinger band right after a contraction (prior-bar ATR under its average),
 * on a volume spike, with RSI short of the extreme on the breakout side.
 */
public class VolatilityBreakoutStrategy extends RuleBasedStrategy {

    private static final int SUB_CONDITIONS = 5;

    private final VolatilityBreakoutParams params;

    public VolatilityBreakoutStrategy(VolatilityBreakoutParams params) {
        if (params == null) {
            throw new IllegalArgumentException("params are required");
        }
        this.params = params;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.VOLATILITY_BREAKOUT;
    }

    @Override
    protected StrategyEvaluation decide(FeatureVector features) {
        double close = features.require(FeatureName.CLOSE);
        double upper = features.require(FeatureName.BB_UPPER);
        double lower = features.require(FeatureName.BB_LOWER);
        double volumeRatio = features.require(FeatureName.VOLUME_RATIO);
        double rsi = features.require(FeatureName.RSI_14);
        double priorAtr = features.require(FeatureName.ATR_LAG1);
        double priorAtrAverage = features.require(FeatureName.ATR_AVG_LAG1);

        boolean contracted = priorAtr < priorAtrAverage * params.contractionFactor();
        boolean volumeSpike = volumeRatio > params.volumeSpikeRatio();
        boolean upperBreak = close > upper;
        boolean lowerBreak = close < lower;

        OptionalDouble width = features.get(FeatureName.BB_WIDTH);
        OptionalDouble priorWidth = features.get(FeatureName.BB_WIDTH_LAG1);
        boolean widthExpanding = width.isPresent() && priorWidth.isPresent()
                && width.getAsDouble() > priorWidth.getAsDouble() * params.widthExpansion();

        Signal signal;
        if (upperBreak && contracted && volumeSpike && rsi < params.rsiUpperExtreme()) {
            signal = new Signal(SignalType.BUY, fraction(count(true, true, true, true, widthExpanding), SUB_CONDITIONS), name());
        } else if (lowerBreak && contracted && volumeSpike && rsi > params.rsiLowerExtreme()) {
            signal = new Signal(SignalType.SELL, fraction(count(true, true, true, true, widthExpanding), SUB_CONDITIONS), name());
        } else {
            signal = Signal.hold(name());
        }

        return new StrategyEvaluation(signal, List.of(
                StrategyDiagnostic.bool("band.break_upper", "Upper Break", "Close above upper band", upperBreak),
                StrategyDiagnostic.bool("band.break_lower", "Lower Break", "Close below lower band", lowerBreak),
                StrategyDiagnostic.bool("atr.contracted", "Prior Contraction", "Prior ATR below its average", contracted),
                StrategyDiagnostic.bool("band.expanding", "Band Expanding", "Band width grew over the prior bar", widthExpanding),
                StrategyDiagnostic.number("volume.ratio", "Volume Ratio", "Volume over 20-bar average", volumeRatio),
                StrategyDiagnostic.number("rsi", "RSI(14)", "", rsi)
        ));
    }
}
