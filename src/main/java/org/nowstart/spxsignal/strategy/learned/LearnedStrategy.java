package org.nowstart.spxsignal.strategy.learned;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.spxsignal.data.exception.InsufficientHistoryException;
import org.nowstart.spxsignal.data.exception.ModelNotTrainedException;
import org.nowstart.spxsignal.data.type.SignalType;
import org.nowstart.spxsignal.data.type.StrategyKind;
import org.nowstart.spxsignal.feature.FeatureSeries;
import org.nowstart.spxsignal.feature.FeatureVector;
import org.nowstart.spxsignal.strategy.core.Signal;
import org.nowstart.spxsignal.strategy.core.SignalStrategy;
import org.nowstart.spxsignal.strategy.core.StrategyDiagnostic;
import org.nowstart.spxsignal.strategy.core.StrategyEvaluation;

/**
 * Classifier strategy over {@link LearnedFeatureSet}, labelled by forward N-bar return.
 *
 * <p>Lifecycle is explicit: construct, {@link #train} once, then {@link #evaluate} any number of times.
 * Evaluating before training fails with {@link ModelNotTrainedException}. A second {@code train} call is
 * rejected; a fresh instance must be created to refit.
 */
@Slf4j
public class LearnedStrategy implements SignalStrategy {

    static final String COMPONENT = "learned-strategy";

    private final LearnedModelParams params;
    private final ForwardReturnLabeler labeler;
    private FeatureScaler scaler;
    private SoftmaxClassifier classifier;
    private TrainingReport report;

    public LearnedStrategy(LearnedModelParams params) {
        if (params == null) {
            throw new IllegalArgumentException("params are required");
        }
        this.params = params;
        this.labeler = new ForwardReturnLabeler(params);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.LEARNED;
    }

    public boolean isTrained() {
        return classifier != null;
    }

    public TrainingReport train(FeatureSeries series) {
        return train(series, series.size());
    }

    /**
     * Fits on bars {@code [0, endExclusive)}. Labels only look at closes inside that range, so no
     * information from {@code endExclusive} onwards reaches the model.
     */
    public TrainingReport train(FeatureSeries series, int endExclusive) {
        if (series == null) {
            throw new IllegalArgumentException("feature series is required");
        }
        if (isTrained()) {
            throw new IllegalStateException("learned strategy is already trained; create a new instance to refit");
        }
        int limit = Math.min(Math.max(endExclusive, 0), series.size());
        double[] close = new double[series.size()];
        for (int i = 0; i < series.size(); i++) {
            close[i] = series.bar(i).close();
        }

        List<double[]> rows = new ArrayList<>();
        List<SignalType> labels = new ArrayList<>();
        Instant lastUsed = null;
        for (int i = 0; i < limit; i++) {
            Optional<SignalType> label = labeler.label(close, i, limit);
            if (label.isEmpty()) {
                continue;
            }
            FeatureVector vector = series.get(i);
            Optional<double[]> row = LearnedFeatureSet.extract(vector);
            if (row.isEmpty()) {
                continue;
            }
            rows.add(row.get());
            labels.add(label.get());
            lastUsed = vector.timestamp();
        }

        if (rows.size() < params.minTrainingRows()) {
            throw new InsufficientHistoryException(
                    COMPONENT,
                    lastUsed,
                    "Learned strategy needs " + params.minTrainingRows() + " labelled rows, got " + rows.size()
            );
        }

        int holdout = (int) Math.floor(rows.size() * params.holdoutRatio());
        int fitCount = rows.size() - holdout;
        double[][] fitRows = rows.subList(0, fitCount).toArray(new double[0][]);
        SignalType[] fitLabels = labels.subList(0, fitCount).toArray(new SignalType[0]);

        FeatureScaler fittedScaler = FeatureScaler.fit(fitRows);
        SoftmaxClassifier fitted = SoftmaxClassifier.fit(fittedScaler.transform(fitRows), fitLabels, params);

        int correct = 0;
        for (int i = fitCount; i < rows.size(); i++) {
            if (argMax(fitted.predictProbabilities(fittedScaler.transform(rows.get(i)))) == labels.get(i)) {
                correct++;
            }
        }
        double accuracy = holdout == 0 ? 0.0 : correct / (double) holdout;

        Map<SignalType, Integer> counts = new EnumMap<>(SignalType.class);
        for (SignalType label : fitLabels) {
            counts.merge(label, 1, Integer::sum);
        }

        this.scaler = fittedScaler;
        this.classifier = fitted;
        this.report = new TrainingReport(fitCount, holdout, accuracy, counts, namedImportances(fitted), lastUsed);
        log.info("[Learned][TRAIN] rows={} holdout={} accuracy={} labels={} trainedThrough={}",
                fitCount, holdout, String.format("%.4f", accuracy), counts, lastUsed);
        return report;
    }

    @Override
    public StrategyEvaluation evaluate(FeatureVector features) {
        if (features == null) {
            throw new IllegalArgumentException("features are required");
        }
        if (!isTrained()) {
            throw new ModelNotTrainedException(COMPONENT, features.timestamp());
        }
        Optional<double[]> row = LearnedFeatureSet.extract(features);
        if (row.isEmpty()) {
            return new StrategyEvaluation(
                    Signal.hold(name()),
                    List.of(StrategyDiagnostic.text("history.missing", "Missing History", "Model input unavailable at this bar", "true"))
            );
        }
        double[] probabilities = classifier.predictProbabilities(scaler.transform(row.get()));
        SignalType predicted = argMax(probabilities);
        double confidence = Math.min(1.0, Math.max(0.0, probabilities[predicted.ordinal()]));
        return new StrategyEvaluation(new Signal(predicted, confidence, name()), List.of(
                StrategyDiagnostic.number("probability.buy", "P(Buy)", "", probabilities[SignalType.BUY.ordinal()]),
                StrategyDiagnostic.number("probability.sell", "P(Sell)", "", probabilities[SignalType.SELL.ordinal()]),
                StrategyDiagnostic.number("probability.hold", "P(Hold)", "", probabilities[SignalType.HOLD.ordinal()])
        ));
    }

    /**
     * Feature key to normalized importance, most important first.
     */
    public Map<String, Double> featureImportances() {
        if (!isTrained()) {
            throw new ModelNotTrainedException(COMPONENT, null);
        }
        Map<String, Double> sorted = new LinkedHashMap<>();
        report.featureImportances().entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return sorted;
    }

    public Optional<TrainingReport> report() {
        return Optional.ofNullable(report);
    }

    private static Map<String, Double> namedImportances(SoftmaxClassifier fitted) {
        double[] importance = fitted.featureImportances();
        Map<String, Double> out = new LinkedHashMap<>();
        for (int j = 0; j < importance.length; j++) {
            out.put(LearnedFeatureSet.FEATURES.get(j).key(), importance[j]);
        }
        return out;
    }

    // HOLD wins exact ties.
    private static SignalType argMax(double[] probabilities) {
        SignalType best = SignalType.HOLD;
        for (SignalType type : SignalType.values()) {
            if (probabilities[type.ordinal()] > probabilities[best.ordinal()]) {
                best = type;
            }
        }
        return best;
    }
}
