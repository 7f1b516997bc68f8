package org.nowstart.spxsignal.ensemble;

import java.util.List;
import org.nowstart.spxsignal.strategy.core.Signal;
import org.nowstart.spxsignal.strategy.core.StrategyDiagnostic;

/**
 * One strategy's contribution to a combined signal.
 */
public record StrategyVote(
        String strategyName,
        double weight,
        Signal signal,
        List<StrategyDiagnostic> diagnostics
) {

    public StrategyVote {
        if (signal == null) {
            throw new IllegalArgumentException("signal is required");
        }
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException("vote weight must be >= 0");
        }
        strategyName = strategyName == null ? signal.strategyName() : strategyName;
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
