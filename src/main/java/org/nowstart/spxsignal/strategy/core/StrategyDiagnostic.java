package org.nowstart.spxsignal.strategy.core;

/**
 * One explainability value attached to a strategy evaluation, e.g. which sub-condition held.
 *
 * <p>Diagnostics never drive the trading decision; they feed the live recommendation breakdown and logs.
 *
 * @param key         stable machine-readable key such as {@code rsi.oversold}
 * @param label       display label
 * @param type        expected value type
 * @param description optional explanation
 * @param value       diagnostic value
 */
public record StrategyDiagnostic(
        String key,
        String label,
        StrategyDiagnosticType type,
        String description,
        Object value
) {

    public StrategyDiagnostic {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("diagnostic key is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("diagnostic type is required");
        }
        if (value == null) {
            throw new IllegalArgumentException("diagnostic value is required");
        }
        label = (label == null || label.isBlank()) ? key : label;
        description = description == null ? "" : description;
        if (!type.supports(value)) {
            throw new IllegalArgumentException("diagnostic " + key + " must be " + type.typeName());
        }
    }

    public static StrategyDiagnostic number(String key, String label, String description, double value) {
        return new StrategyDiagnostic(key, label, StrategyDiagnosticType.NUMBER, description, value);
    }

    public static StrategyDiagnostic bool(String key, String label, String description, boolean value) {
        return new StrategyDiagnostic(key, label, StrategyDiagnosticType.BOOLEAN, description, value);
    }

    public static StrategyDiagnostic text(String key, String label, String description, String value) {
        return new StrategyDiagnostic(key, label, StrategyDiagnosticType.STRING, description, value == null ? "" : value);
    }
}
