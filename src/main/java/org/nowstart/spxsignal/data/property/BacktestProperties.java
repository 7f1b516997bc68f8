package org.nowstart.spxsignal.data.property;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.spxsignal.data.exception.InvalidConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "backtest")
public record BacktestProperties(
        Boolean enabled,
        Instant fromDt,
        Instant toDt,
        Double trainingRatio,
        Boolean sweepEnabled,
        String sweepStopLossRange,
        String sweepProfitTargetRange,
        Integer topK,
        Integer sweepParallelism
) {
    private static final Instant DEFAULT_FROM = Instant.parse("2015-01-01T00:00:00Z");
    private static final double DEFAULT_TRAINING_RATIO = 0.7;
    private static final int DEFAULT_SWEEP_PARALLELISM = Math.max(1, Runtime.getRuntime().availableProcessors());
    private static final String DEFAULT_STOP_LOSS_RANGE = "0.3:0.6:0.1";
    private static final String DEFAULT_PROFIT_TARGET_RANGE = "0.15:0.45:0.1";

    public BacktestProperties {
        enabled = enabled != null ? enabled : false;
        fromDt = fromDt != null ? fromDt : DEFAULT_FROM;
        toDt = toDt != null ? toDt : Instant.now();
        trainingRatio = trainingRatio != null ? trainingRatio : DEFAULT_TRAINING_RATIO;
        sweepEnabled = sweepEnabled != null ? sweepEnabled : true;
        sweepStopLossRange = normalizeSpec(sweepStopLossRange, DEFAULT_STOP_LOSS_RANGE);
        sweepProfitTargetRange = normalizeSpec(sweepProfitTargetRange, DEFAULT_PROFIT_TARGET_RANGE);
        topK = topK != null ? topK : 5;
        sweepParallelism = sweepParallelism != null ? sweepParallelism : DEFAULT_SWEEP_PARALLELISM;

        if (trainingRatio <= 0.0 || trainingRatio >= 1.0) {
            throw new InvalidConfigurationException("backtest training-ratio must be between 0 and 1");
        }
        if (fromDt.isAfter(toDt)) {
            throw new InvalidConfigurationException("backtest from-dt must be <= to-dt");
        }
        if (topK <= 0) {
            throw new InvalidConfigurationException("backtest top-k must be > 0");
        }
        if (sweepParallelism <= 0) {
            throw new InvalidConfigurationException("backtest sweep-parallelism must be > 0");
        }
    }

    public List<Double> resolveStopLossValues() {
        return parseFractionRange(sweepStopLossRange, "sweep-stop-loss-range", true);
    }

    public List<Double> resolveProfitTargetValues() {
        return parseFractionRange(sweepProfitTargetRange, "sweep-profit-target-range", false);
    }

    public long combinationCount() {
        return (long) resolveStopLossValues().size() * resolveProfitTargetValues().size();
    }

    private static String normalizeSpec(String raw, String defaults) {
        if (raw == null || raw.isBlank()) {
            return defaults;
        }
        return raw.trim();
    }

    private static List<Double> parseFractionRange(String spec, String fieldName, boolean capAtOne) {
        List<Double> values = parseDoubleRange(spec);
        for (double value : values) {
            if (value <= 0.0 || (capAtOne && value > 1.0)) {
                throw new InvalidConfigurationException(fieldName + " values must be in " + (capAtOne ? "(0, 1]" : "(0, inf)"));
            }
        }
        return values;
    }

    static List<Double> parseDoubleRange(String spec) {
        String[] parts = spec.split(":");
        if (parts.length != 3) {
            throw new InvalidConfigurationException("range must be start:end:step, got: " + spec);
        }
        double start;
        double end;
        double step;
        try {
            start = Double.parseDouble(parts[0].trim());
            end = Double.parseDouble(parts[1].trim());
            step = Double.parseDouble(parts[2].trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("range must be numeric start:end:step, got: " + spec);
        }
        if (step <= 0) {
            throw new InvalidConfigurationException("range step must be > 0, got: " + spec);
        }
        if (end < start) {
            throw new InvalidConfigurationException("range end must be >= start, got: " + spec);
        }

        List<Double> out = new ArrayList<>();
        for (int i = 0; ; i++) {
            double value = start + i * step;
            if (value > end + 1e-12) {
                break;
            }
            out.add(Math.round(value * 1e9) / 1e9);
        }
        return List.copyOf(out);
    }
}
