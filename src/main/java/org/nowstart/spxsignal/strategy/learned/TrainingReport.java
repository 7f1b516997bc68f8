package org.nowstart.spxsignal.strategy.learned;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.nowstart.spxsignal.data.type.SignalType;

/**
 * Outcome of fitting the learned strategy.
 *
 * @param trainedThrough    timestamp of the last bar whose features were used for fitting
 * @param holdoutAccuracy   share of holdout rows classified correctly, 0 when there is no holdout
 * @param featureImportances feature key to normalized importance, in input order
 */
public record TrainingReport(
        int trainingRows,
        int holdoutRows,
        double holdoutAccuracy,
        Map<SignalType, Integer> labelCounts,
        Map<String, Double> featureImportances,
        Instant trainedThrough
) {

    public TrainingReport {
        labelCounts = labelCounts == null || labelCounts.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(labelCounts));
        featureImportances = featureImportances == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(featureImportances));
    }
}
