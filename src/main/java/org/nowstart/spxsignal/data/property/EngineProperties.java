package org.nowstart.spxsignal.data.property;

import jakarta.validation.constraints.Positive;
import java.util.Map;
import org.nowstart.spxsignal.backtest.OptionProxyParams;
import org.nowstart.spxsignal.backtest.RiskLimits;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.nowstart.spxsignal.strategy.learned.LearnedModelParams;
import org.nowstart.spxsignal.strategy.rule.MeanReversionParams;
import org.nowstart.spxsignal.strategy.rule.MomentumBreakoutParams;
import org.nowstart.spxsignal.strategy.rule.VolatilityBreakoutParams;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "spxsignal.engine")
public record EngineProperties(
        // starting capital of every run
        @Positive @DefaultValue("100000") double initialCapital,
        // strategy name -> vote weight, must sum to 1
        Map<String, Double> strategyWeights,
        @DefaultValue Risk risk,
        @DefaultValue OptionProxy optionProxy,
        @DefaultValue MeanReversion meanReversion,
        @DefaultValue MomentumBreakout momentumBreakout,
        @DefaultValue VolatilityBreakout volatilityBreakout,
        @DefaultValue Learned learned
) {

    /**
     * Immutable run configuration; domain validation failures surface here as
     * {@link org.nowstart.spxsignal.data.exception.InvalidConfigurationException}.
     */
    public StrategyConfig toStrategyConfig() {
        StrategyConfig defaults = StrategyConfig.defaults();
        return new StrategyConfig(
                initialCapital,
                new RiskLimits(
                        risk.maxRiskPerTrade(),
                        risk.maxPortfolioRisk(),
                        risk.stopLossPct(),
                        risk.profitTargetPct(),
                        risk.maxHoldingDays(),
                        risk.maxPositionSize()
                ),
                strategyWeights == null || strategyWeights.isEmpty()
                        ? defaults.strategyWeights()
                        : StrategyConfig.weightsByName(strategyWeights),
                new OptionProxyParams(
                        optionProxy.premiumRatio(),
                        optionProxy.leverage(),
                        optionProxy.strikeOffsetPct(),
                        optionProxy.contractMultiplier()
                ),
                new MeanReversionParams(
                        meanReversion.rsiOversold(),
                        meanReversion.rsiOverbought(),
                        meanReversion.bandPositionLow(),
                        meanReversion.bandPositionHigh(),
                        meanReversion.williamsOversold(),
                        meanReversion.williamsOverbought(),
                        meanReversion.volumeSpikeRatio()
                ),
                new MomentumBreakoutParams(momentumBreakout.adxThreshold(), momentumBreakout.volumeConfirmRatio()),
                new VolatilityBreakoutParams(
                        volatilityBreakout.volumeSpikeRatio(),
                        volatilityBreakout.rsiUpperExtreme(),
                        volatilityBreakout.rsiLowerExtreme(),
                        volatilityBreakout.contractionFactor(),
                        volatilityBreakout.widthExpansion()
                ),
                new LearnedModelParams(
                        learned.horizonBars(),
                        learned.buyReturn(),
                        learned.sellReturn(),
                        learned.learningRate(),
                        learned.epochs(),
                        learned.l2Penalty(),
                        learned.holdoutRatio(),
                        learned.minTrainingRows()
                )
        );
    }

    public record Risk(
            @DefaultValue("0.02") double maxRiskPerTrade,
            @DefaultValue("0.10") double maxPortfolioRisk,
            @DefaultValue("0.50") double stopLossPct,
            @DefaultValue("0.25") double profitTargetPct,
            // days-to-expiry analogue
            @DefaultValue("30") int maxHoldingDays,
            @DefaultValue("100") int maxPositionSize
    ) {
    }

    public record OptionProxy(
            @DefaultValue("0.03") double premiumRatio,
            @DefaultValue("10.0") double leverage,
            @DefaultValue("0.02") double strikeOffsetPct,
            @DefaultValue("100") int contractMultiplier
    ) {
    }

    public record MeanReversion(
            @DefaultValue("30") double rsiOversold,
            @DefaultValue("70") double rsiOverbought,
            @DefaultValue("0.05") double bandPositionLow,
            @DefaultValue("0.95") double bandPositionHigh,
            @DefaultValue("-80") double williamsOversold,
            @DefaultValue("-20") double williamsOverbought,
            @DefaultValue("1.5") double volumeSpikeRatio
    ) {
    }

    public record MomentumBreakout(
            @DefaultValue("25") double adxThreshold,
            @DefaultValue("1.2") double volumeConfirmRatio
    ) {
    }

    public record VolatilityBreakout(
            @DefaultValue("1.5") double volumeSpikeRatio,
            @DefaultValue("80") double rsiUpperExtreme,
            @DefaultValue("20") double rsiLowerExtreme,
            @DefaultValue("1.0") double contractionFactor,
            @DefaultValue("1.1") double widthExpansion
    ) {
    }

    public record Learned(
            // forward-return horizon in bars
            @DefaultValue("5") int horizonBars,
            @DefaultValue("0.005") double buyReturn,
            @DefaultValue("-0.005") double sellReturn,
            @DefaultValue("0.1") double learningRate,
            @DefaultValue("300") int epochs,
            @DefaultValue("0.001") double l2Penalty,
            // trailing share of labelled rows used for hold-out accuracy
            @DefaultValue("0.2") double holdoutRatio,
            @DefaultValue("100") int minTrainingRows
    ) {
    }
}
