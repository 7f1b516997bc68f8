package org.nowstart.spxsignal.backtest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.spxsignal.data.property.ReportProperties;
import org.nowstart.spxsignal.data.type.ExitReason;
import org.nowstart.spxsignal.data.type.OptionSide;
import org.nowstart.spxsignal.data.type.SignalType;
import org.nowstart.spxsignal.data.type.StrategyKind;
import org.nowstart.spxsignal.ensemble.EnsembleCombiner;
import org.nowstart.spxsignal.ensemble.StrategyEnsemble;
import org.nowstart.spxsignal.feature.FeatureSeries;
import org.nowstart.spxsignal.market.Bar;
import org.nowstart.spxsignal.report.PerformanceReporter;
import org.nowstart.spxsignal.strategy.StrategyRegistry;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.nowstart.spxsignal.support.BarFixtures;
import org.nowstart.spxsignal.support.ScriptedSignals;

class BacktestEngineTest {

    private static final OptionProxyParams HALF_PREMIUM = new OptionProxyParams(0.5, 10.0, 0.02, 100);
    private static final RiskLimits WIDE_RISK = new RiskLimits(0.5, 1.0, 0.5, 0.25, 30, 100);

    private final BacktestEngine engine = new BacktestEngine(new PerformanceReporter(ReportProperties.DEFAULTS));

    @Test
    void run_flatSeriesWithRuleStrategiesNeverTrades() {
        StrategyConfig config = ruleOnly();
        FeatureSeries features = BarFixtures.features(BarFixtures.flat(5, 100.0));
        StrategyEnsemble ensemble = new StrategyEnsemble(
                new StrategyRegistry().activeStrategies(config, null), config, new EnsembleCombiner());

        BacktestResult result = engine.run("SPX", features, config, ensemble);

        assertThat(result.trades()).isEmpty();
        assertThat(result.capitalSeries()).hasSize(5)
                .allSatisfy(point -> assertThat(point.capital()).isEqualTo(100_000.0));
        assertThat(result.finalCapital()).isEqualTo(100_000.0);
        assertThat(result.summary().totalTrades()).isZero();
        assertThat(result.summary().sharpeRatio()).isZero();
    }

    @Test
    void run_stopLossFillsAtStopPremium() {
        FeatureSeries features = BarFixtures.features(List.of(
                BarFixtures.bar(0, 200.0),
                BarFixtures.bar(1, 199.0, 201.0, 189.0, 195.0, 1_000.0),
                BarFixtures.bar(2, 195.0)
        ));

        BacktestResult result = engine.run("SPX", features, scenarioConfig(WIDE_RISK),
                new ScriptedSignals().at(0, SignalType.BUY));

        assertThat(result.trades()).hasSize(1);
        TradeRecord trade = result.trades().get(0);
        assertThat(trade.side()).isEqualTo(OptionSide.CALL);
        assertThat(trade.quantity()).isEqualTo(10);
        assertThat(trade.entryPremium()).isEqualTo(100.0);
        assertThat(trade.exitReason()).isEqualTo(ExitReason.STOP_LOSS);
        assertThat(trade.exitPremium()).isEqualTo(50.0);
        assertThat(trade.returnPct()).isEqualTo(-0.5);
        assertThat(trade.pnl()).isEqualTo(-50_000.0);
        assertThat(trade.strikeReference()).isCloseTo(204.0, within(1e-9));
        assertThat(result.capitalSeries()).extracting(CapitalPoint::capital)
                .containsExactly(100_000.0, 50_000.0, 50_000.0);
        assertThat(result.summary().maxDrawdown()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void run_profitTargetFillsAtTargetPremium() {
        FeatureSeries features = BarFixtures.features(List.of(
                BarFixtures.bar(0, 200.0),
                BarFixtures.bar(1, 200.0, 206.0, 199.0, 203.0, 1_000.0),
                BarFixtures.bar(2, 203.0)
        ));

        BacktestResult result = engine.run("SPX", features, scenarioConfig(WIDE_RISK),
                new ScriptedSignals().at(0, SignalType.BUY));

        TradeRecord trade = result.trades().get(0);
        assertThat(trade.exitReason()).isEqualTo(ExitReason.PROFIT_TARGET);
        assertThat(trade.exitPremium()).isEqualTo(125.0);
        assertThat(trade.pnl()).isCloseTo(25_000.0, within(1e-9));
        assertThat(result.finalCapital()).isCloseTo(125_000.0, within(1e-9));
    }

    @Test
    void run_stopLossTakesPrecedenceOverReversalAndFlatPositionMayReopen() {
        FeatureSeries features = BarFixtures.features(List.of(
                BarFixtures.bar(0, 200.0),
                BarFixtures.bar(1, 199.0, 201.0, 189.0, 195.0, 1_000.0),
                BarFixtures.bar(2, 195.0)
        ));

        BacktestResult result = engine.run("SPX", features, scenarioConfig(WIDE_RISK),
                new ScriptedSignals().at(0, SignalType.BUY).at(1, SignalType.SELL));

        assertThat(result.trades()).extracting(TradeRecord::exitReason)
                .containsExactly(ExitReason.STOP_LOSS, ExitReason.END_OF_DATA);
        TradeRecord reopened = result.trades().get(1);
        assertThat(reopened.side()).isEqualTo(OptionSide.PUT);
        assertThat(reopened.entryTime()).isEqualTo(BarFixtures.day(1));
        assertThat(reopened.entryPremium()).isEqualTo(97.5);
        assertThat(reopened.quantity()).isEqualTo(5);
    }

    @Test
    void run_opposingSignalClosesAtCloseMark() {
        FeatureSeries features = BarFixtures.features(BarFixtures.flat(3, 200.0));

        BacktestResult result = engine.run("SPX", features, scenarioConfig(WIDE_RISK),
                new ScriptedSignals().at(0, SignalType.BUY).at(1, SignalType.SELL));

        assertThat(result.trades()).extracting(TradeRecord::exitReason)
                .containsExactly(ExitReason.SIGNAL_REVERSAL, ExitReason.END_OF_DATA);
        assertThat(result.trades()).extracting(TradeRecord::side).containsExactly(OptionSide.CALL, OptionSide.PUT);
        assertThat(result.trades().get(0).exitPremium()).isEqualTo(100.0);
        assertThat(result.finalCapital()).isEqualTo(100_000.0);
    }

    @Test
    void run_sameSideSignalKeepsPositionOpen() {
        FeatureSeries features = BarFixtures.features(BarFixtures.flat(4, 200.0));

        BacktestResult result = engine.run("SPX", features, scenarioConfig(WIDE_RISK),
                new ScriptedSignals().at(0, SignalType.BUY).at(1, SignalType.BUY).at(2, SignalType.BUY));

        assertThat(result.trades()).hasSize(1);
        assertThat(result.trades().get(0).exitReason()).isEqualTo(ExitReason.END_OF_DATA);
        assertThat(result.trades().get(0).entryTime()).isEqualTo(BarFixtures.day(0));
    }

    @Test
    void run_expiresAfterMaxHoldingDays() {
        FeatureSeries features = BarFixtures.features(BarFixtures.flat(4, 200.0));
        RiskLimits shortHold = new RiskLimits(0.5, 1.0, 0.5, 0.25, 2, 100);

        BacktestResult result = engine.run("SPX", features, scenarioConfig(shortHold),
                new ScriptedSignals().at(0, SignalType.BUY));

        assertThat(result.trades()).hasSize(1);
        TradeRecord trade = result.trades().get(0);
        assertThat(trade.exitReason()).isEqualTo(ExitReason.EXPIRY);
        assertThat(trade.exitTime()).isEqualTo(BarFixtures.day(2));
        assertThat(trade.pnl()).isZero();
    }

    @Test
    void run_neverEntersOnLastBar() {
        FeatureSeries features = BarFixtures.features(BarFixtures.flat(3, 200.0));

        BacktestResult result = engine.run("SPX", features, scenarioConfig(WIDE_RISK),
                new ScriptedSignals().at(2, SignalType.BUY));

        assertThat(result.trades()).isEmpty();
    }

    @Test
    void run_skipsEntryWhenRiskBudgetBuysLessThanOneContract() {
        FeatureSeries features = BarFixtures.features(BarFixtures.flat(5, 5_000.0));
        ScriptedSignals signals = new ScriptedSignals();
        for (int i = 0; i < 5; i++) {
            signals.at(i, SignalType.BUY);
        }

        BacktestResult result = engine.run("SPX", features, StrategyConfig.defaults(), signals);

        assertThat(result.trades()).isEmpty();
        assertThat(result.finalCapital()).isEqualTo(100_000.0);
    }

    @Test
    void run_holdsAtMostOnePositionAtATime() {
        List<Bar> bars = BarFixtures.wave(120);
        ScriptedSignals signals = new ScriptedSignals();
        for (int i = 0; i < bars.size(); i++) {
            signals.at(i, i % 7 < 4 ? SignalType.BUY : SignalType.SELL);
        }

        BacktestResult result = engine.run("SPX", BarFixtures.features(bars), scenarioConfig(WIDE_RISK), signals);

        List<TradeRecord> trades = result.trades();
        assertThat(trades).isNotEmpty();
        for (int k = 1; k < trades.size(); k++) {
            assertThat(trades.get(k).entryTime()).isAfterOrEqualTo(trades.get(k - 1).exitTime());
        }
        double pnl = trades.stream().mapToDouble(TradeRecord::pnl).sum();
        assertThat(result.finalCapital()).isCloseTo(100_000.0 + pnl, within(1e-6));
    }

    @Test
    void run_replayIsDeterministic() {
        StrategyConfig config = ruleOnly();
        FeatureSeries features = BarFixtures.features(BarFixtures.wave(300));
        StrategyRegistry registry = new StrategyRegistry();

        BacktestResult first = engine.run("SPX", features, config,
                new StrategyEnsemble(registry.activeStrategies(config, null), config, new EnsembleCombiner()));
        BacktestResult second = engine.run("SPX", features, config,
                new StrategyEnsemble(registry.activeStrategies(config, null), config, new EnsembleCombiner()));

        assertThat(second.trades()).isEqualTo(first.trades());
        assertThat(second.capitalSeries()).isEqualTo(first.capitalSeries());
        assertThat(second.summary()).isEqualTo(first.summary());
    }

    @Test
    void run_startIndexSkipsWarmupBars() {
        FeatureSeries features = BarFixtures.features(BarFixtures.flat(6, 200.0));

        BacktestResult result = engine.run("SPX", features, 4, scenarioConfig(WIDE_RISK),
                new ScriptedSignals().at(0, SignalType.BUY));

        assertThat(result.capitalSeries()).hasSize(2);
        assertThat(result.trades()).isEmpty();
    }

    @Test
    void run_rejectsStartOutsideSeries() {
        FeatureSeries features = BarFixtures.features(BarFixtures.flat(3, 200.0));

        assertThatThrownBy(() -> engine.run("SPX", features, 4, StrategyConfig.defaults(), new ScriptedSignals()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void simulationContext_rejectsSecondOpenPosition() {
        SimulationContext context = new SimulationContext("SPX", 100_000.0);
        context.open(position());

        assertThatThrownBy(() -> context.open(position())).isInstanceOf(IllegalStateException.class);
    }

    private static Position position() {
        return Position.builder()
                .symbol("SPX")
                .side(OptionSide.CALL)
                .strikeReference(204.0)
                .quantity(1)
                .contractMultiplier(100)
                .entryPremium(6.0)
                .entryUnderlying(200.0)
                .entryConfidence(1.0)
                .entryTime(BarFixtures.day(0))
                .build();
    }

    private static StrategyConfig scenarioConfig(RiskLimits risk) {
        return new StrategyConfig(
                100_000.0,
                risk,
                StrategyConfig.defaults().strategyWeights(),
                HALF_PREMIUM,
                StrategyConfig.defaults().meanReversion(),
                StrategyConfig.defaults().momentumBreakout(),
                StrategyConfig.defaults().volatilityBreakout(),
                StrategyConfig.defaults().learned()
        );
    }

    private static StrategyConfig ruleOnly() {
        Map<StrategyKind, Double> weights = new EnumMap<>(StrategyKind.class);
        weights.put(StrategyKind.MEAN_REVERSION, 0.4);
        weights.put(StrategyKind.MOMENTUM_BREAKOUT, 0.3);
        weights.put(StrategyKind.VOLATILITY_BREAKOUT, 0.3);
        return StrategyConfig.defaults().withWeights(weights);
    }
}
