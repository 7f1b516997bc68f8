package org.nowstart.spxsignal.backtest;

import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.spxsignal.data.type.ExitReason;
import org.nowstart.spxsignal.data.type.OptionSide;
import org.nowstart.spxsignal.data.type.SignalType;
import org.nowstart.spxsignal.ensemble.CombinedSignal;
import org.nowstart.spxsignal.feature.FeatureSeries;
import org.nowstart.spxsignal.feature.FeatureVector;
import org.nowstart.spxsignal.market.Bar;
import org.nowstart.spxsignal.report.PerformanceReporter;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.springframework.stereotype.Service;

/**
 * Sequential option-proxy simulation: Flat, Open, Closed, with at most one open position.
 *
 * <p>Each bar is processed in three steps: exits for the open position (stop-loss, profit-target,
 * signal reversal, expiry, first match wins), then an entry when flat and the combined signal is
 * actionable, then the capital point. Decisions at a bar only see that bar and earlier ones.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestEngine {

    private final PerformanceReporter performanceReporter;

    public BacktestResult run(String symbol, FeatureSeries features, StrategyConfig config, SignalSource signals) {
        return run(symbol, features, 0, config, signals);
    }

    /**
     * @param startIndex first bar that is simulated; earlier bars only provide indicator history
     */
    public BacktestResult run(String symbol, FeatureSeries features, int startIndex, StrategyConfig config, SignalSource signals) {
        if (features == null || config == null || signals == null) {
            throw new IllegalArgumentException("features, config and signals are required");
        }
        if (startIndex < 0 || startIndex > features.size()) {
            throw new IllegalArgumentException("startIndex outside series: " + startIndex);
        }

        PremiumModel premiums = new PremiumModel(config.optionProxy());
        PositionSizer sizer = new PositionSizer(config.risk(), premiums.contractMultiplier());
        SimulationContext context = new SimulationContext(symbol, config.initialCapital());
        int last = features.size() - 1;

        log.info("[Backtest][START] symbol={} bars={} start={} capital={}",
                symbol, features.size() - startIndex, startIndex, config.initialCapital());

        for (int i = startIndex; i <= last; i++) {
            Bar bar = features.bar(i);
            FeatureVector vector = features.get(i);
            CombinedSignal combined = signals.signalAt(vector);

            context.openPosition().ifPresent(position -> handleOpenPosition(context, position, bar, combined, config, premiums));
            if (context.isFlat() && combined.type().isActionable() && i < last) {
                tryOpen(context, bar, combined, premiums, sizer);
            }
            if (i == last && !context.isFlat()) {
                closeAtEnd(context, bar, premiums);
            }
            context.recordCapital(bar.timestamp());
        }

        BacktestResult result = new BacktestResult(
                symbol,
                config,
                context.trades(),
                context.capitalSeries(),
                performanceReporter.summarize(config.initialCapital(), context.trades(), context.capitalSeries()),
                null
        );
        log.info("[Backtest][END] symbol={} trades={} finalCapital={} totalReturn={}",
                symbol, result.trades().size(), result.finalCapital(), result.summary().totalReturn());
        return result;
    }

    private void handleOpenPosition(
            SimulationContext context,
            Position position,
            Bar bar,
            CombinedSignal combined,
            StrategyConfig config,
            PremiumModel premiums
    ) {
        Optional<ExitDecision> exit = evaluateExit(position, bar, combined, config.risk(), premiums);
        if (exit.isPresent()) {
            ExitDecision decision = exit.get();
            TradeRecord trade = context.close(decision.premium(), bar.close(), bar.timestamp(), decision.reason());
            log.info("[Backtest][CLOSE] ts={} side={} reason={} premium={} pnl={} capital={}",
                    bar.timestamp(), trade.side(), trade.exitReason(), trade.exitPremium(), trade.pnl(), context.capital());
            return;
        }
        position.markTo(premiums.mark(position.getEntryPremium(), position.getEntryUnderlying(), bar.close(), position.getSide()));
    }

    /**
     * Stop-loss and profit-target fill at their threshold premium when the bar's range touches them;
     * reversal and expiry fill at the close mark.
     */
    Optional<ExitDecision> evaluateExit(Position position, Bar bar, CombinedSignal combined, RiskLimits risk, PremiumModel premiums) {
        OptionSide side = position.getSide();
        double entryPremium = position.getEntryPremium();
        double entryUnderlying = position.getEntryUnderlying();
        double adverseUnderlying = side == OptionSide.CALL ? bar.low() : bar.high();
        double favorableUnderlying = side == OptionSide.CALL ? bar.high() : bar.low();

        double stopPremium = entryPremium * (1.0 - risk.stopLossPct());
        double targetPremium = entryPremium * (1.0 + risk.profitTargetPct());

        if (premiums.mark(entryPremium, entryUnderlying, adverseUnderlying, side) <= stopPremium) {
            return Optional.of(new ExitDecision(ExitReason.STOP_LOSS, stopPremium));
        }
        if (premiums.mark(entryPremium, entryUnderlying, favorableUnderlying, side) >= targetPremium) {
            return Optional.of(new ExitDecision(ExitReason.PROFIT_TARGET, targetPremium));
        }
        double closeMark = premiums.mark(entryPremium, entryUnderlying, bar.close(), side);
        SignalType opposing = side.opposingSignal();
        if (combined.type() == opposing) {
            return Optional.of(new ExitDecision(ExitReason.SIGNAL_REVERSAL, closeMark));
        }
        if (position.daysHeld(bar.timestamp()) >= risk.maxHoldingDays()) {
            return Optional.of(new ExitDecision(ExitReason.EXPIRY, closeMark));
        }
        return Optional.empty();
    }

    private void tryOpen(SimulationContext context, Bar bar, CombinedSignal combined, PremiumModel premiums, PositionSizer sizer) {
        OptionSide side = OptionSide.forSignal(combined.type());
        double premium = premiums.entryPremium(bar.close());
        int quantity = sizer.quantity(context.capital(), premium);
        if (quantity < 1) {
            log.warn("[Backtest][SKIP] ts={} side={} premium={} capital={} reason=zero_size",
                    bar.timestamp(), side, premium, context.capital());
            return;
        }
        Position position = Position.builder()
                .symbol(context.symbol())
                .side(side)
                .strikeReference(premiums.strikeReference(bar.close(), side))
                .quantity(quantity)
                .contractMultiplier(premiums.contractMultiplier())
                .entryPremium(premium)
                .entryUnderlying(bar.close())
                .entryConfidence(combined.confidence())
                .entryTime(bar.timestamp())
                .build();
        context.open(position);
        log.info("[Backtest][OPEN] ts={} side={} qty={} premium={} strike={} confidence={}",
                bar.timestamp(), side, quantity, premium, position.getStrikeReference(), combined.confidence());
    }

    private void closeAtEnd(SimulationContext context, Bar bar, PremiumModel premiums) {
        Position position = context.openPosition().orElseThrow();
        double mark = premiums.mark(position.getEntryPremium(), position.getEntryUnderlying(), bar.close(), position.getSide());
        TradeRecord trade = context.close(mark, bar.close(), bar.timestamp(), ExitReason.END_OF_DATA);
        log.info("[Backtest][CLOSE] ts={} side={} reason={} premium={} pnl={} capital={}",
                bar.timestamp(), trade.side(), trade.exitReason(), trade.exitPremium(), trade.pnl(), context.capital());
    }

    record ExitDecision(ExitReason reason, double premium) {
    }
}
