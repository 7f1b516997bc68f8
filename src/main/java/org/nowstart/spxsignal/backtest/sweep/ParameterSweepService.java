package org.nowstart.spxsignal.backtest.sweep;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.PriorityQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntFunction;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.spxsignal.backtest.BacktestResult;
import org.nowstart.spxsignal.backtest.PreparedRun;
import org.nowstart.spxsignal.service.BacktestService;
import org.nowstart.spxsignal.strategy.core.StrategyConfig;
import org.springframework.stereotype.Service;

/**
 * Runs independent backtests over a stop-loss x profit-target grid and keeps the best {@code topK}.
 *
 * <p>Every variant gets its own {@code StrategyConfig} and simulation context; the prepared features and
 * fitted learned strategy are shared read-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParameterSweepService {

    private final BacktestService backtestService;

    public List<SweepRow> sweep(
            PreparedRun prepared,
            StrategyConfig base,
            List<Double> stopLossValues,
            List<Double> profitTargetValues,
            int topK,
            int parallelism
    ) {
        if (stopLossValues.isEmpty() || profitTargetValues.isEmpty()) {
            throw new IllegalArgumentException("sweep axes must not be empty");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be > 0");
        }
        int targets = profitTargetValues.size();
        int total = stopLossValues.size() * targets;
        Comparator<SweepRow> better = rankingComparator();
        long startedAtNanos = System.nanoTime();

        PriorityQueue<SweepRow> heap = runSweep(total, parallelism, topK, better, index -> {
            double stopLoss = stopLossValues.get(index / targets);
            double profitTarget = profitTargetValues.get(index % targets);
            StrategyConfig variant = base.withRisk(base.risk().withExits(stopLoss, profitTarget));
            return toRow(backtestService.execute(prepared, variant), stopLoss, profitTarget);
        });

        double elapsedSec = Math.max(1e-9, (System.nanoTime() - startedAtNanos) / 1_000_000_000.0);
        log.info("[Sweep][Done] variants={} topK={} elapsedSec={}",
                total, topK, String.format(Locale.US, "%.2f", elapsedSec));

        List<SweepRow> out = new ArrayList<>(heap);
        out.sort(better);
        return List.copyOf(out);
    }

    private SweepRow toRow(BacktestResult result, double stopLoss, double profitTarget) {
        return new SweepRow(
                stopLoss,
                profitTarget,
                result.summary().sharpeRatio(),
                result.summary().totalReturn(),
                result.summary().maxDrawdown(),
                result.summary().totalTrades(),
                result.summary().finalCapital()
        );
    }

    Comparator<SweepRow> rankingComparator() {
        return Comparator
                .comparingDouble((SweepRow row) -> rankValue(row.sharpeRatio())).reversed()
                .thenComparing(Comparator.comparingDouble((SweepRow row) -> rankValue(row.totalReturn())).reversed())
                .thenComparingDouble(SweepRow::stopLossPct)
                .thenComparingDouble(SweepRow::profitTargetPct);
    }

    private PriorityQueue<SweepRow> runSweep(
            int total,
            int parallelism,
            int topK,
            Comparator<SweepRow> better,
            IntFunction<SweepRow> evaluator
    ) {
        if (parallelism <= 1) {
            return searchOnStream(IntStream.range(0, total), topK, better, evaluator);
        }

        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            return pool.submit(() -> searchOnStream(IntStream.range(0, total).parallel(), topK, better, evaluator)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Parameter sweep interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Parameter sweep failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    private PriorityQueue<SweepRow> searchOnStream(
            IntStream stream,
            int topK,
            Comparator<SweepRow> better,
            IntFunction<SweepRow> evaluator
    ) {
        return stream.collect(
                () -> new PriorityQueue<>(topK, better.reversed()),
                (heap, index) -> offerTopK(heap, evaluator.apply(index), topK, better),
                (left, right) -> {
                    for (SweepRow row : right) {
                        offerTopK(left, row, topK, better);
                    }
                }
        );
    }

    private void offerTopK(PriorityQueue<SweepRow> heap, SweepRow row, int topK, Comparator<SweepRow> better) {
        if (heap.size() < topK) {
            heap.offer(row);
            return;
        }
        SweepRow worst = heap.peek();
        if (worst != null && better.compare(row, worst) < 0) {
            heap.poll();
            heap.offer(row);
        }
    }

    private double rankValue(double value) {
        return Double.isFinite(value) ? value : Double.NEGATIVE_INFINITY;
    }
}
