package org.nowstart.spxsignal.strategy.core;

import java.util.List;

/**
 * Immutable output of one strategy evaluation: the signal plus its diagnostics.
 */
public record StrategyEvaluation(
        Signal signal,
        List<StrategyDiagnostic> diagnostics
) {

    public StrategyEvaluation {
        if (signal == null) {
            throw new IllegalArgumentException("signal is required");
        }
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static StrategyEvaluation of(Signal signal) {
        return new StrategyEvaluation(signal, List.of());
    }
}
