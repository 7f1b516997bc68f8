package org.nowstart.spxsignal.strategy.learned;

import java.util.Arrays;
import java.util.List;
import org.nowstart.spxsignal.data.type.SignalType;

/**
 * Multinomial logistic regression fitted with full-batch gradient descent from a zero start,
 * so identical rows and settings always give identical weights.
 */
final class SoftmaxClassifier {

    private final List<SignalType> classes;
    private final double[][] weights;
    private final double[] bias;

    private SoftmaxClassifier(List<SignalType> classes, double[][] weights, double[] bias) {
        this.classes = classes;
        this.weights = weights;
        this.bias = bias;
    }

    static SoftmaxClassifier fit(double[][] rows, SignalType[] labels, LearnedModelParams params) {
        if (rows.length == 0 || rows.length != labels.length) {
            throw new IllegalArgumentException("rows and labels must be non-empty and aligned");
        }
        List<SignalType> classes = Arrays.stream(labels).distinct().sorted().toList();
        int n = rows.length;
        int d = rows[0].length;
        int k = classes.size();
        double[][] w = new double[k][d];
        double[] b = new double[k];
        if (k == 1) {
            return new SoftmaxClassifier(classes, w, b);
        }

        int[] target = new int[n];
        for (int i = 0; i < n; i++) {
            target[i] = classes.indexOf(labels[i]);
        }

        double[] logits = new double[k];
        double[] probs = new double[k];
        for (int epoch = 0; epoch < params.epochs(); epoch++) {
            double[][] gradW = new double[k][d];
            double[] gradB = new double[k];
            for (int i = 0; i < n; i++) {
                double[] x = rows[i];
                softmax(w, b, x, logits, probs);
                for (int c = 0; c < k; c++) {
                    double error = probs[c] - (target[i] == c ? 1.0 : 0.0);
                    gradB[c] += error;
                    for (int j = 0; j < d; j++) {
                        gradW[c][j] += error * x[j];
                    }
                }
            }
            for (int c = 0; c < k; c++) {
                b[c] -= params.learningRate() * gradB[c] / n;
                for (int j = 0; j < d; j++) {
                    double gradient = gradW[c][j] / n + params.l2Penalty() * w[c][j];
                    w[c][j] -= params.learningRate() * gradient;
                }
            }
        }
        return new SoftmaxClassifier(classes, w, b);
    }

    /**
     * Probability per class, indexed by {@link SignalType#ordinal()}; classes absent from training get 0.
     */
    double[] predictProbabilities(double[] row) {
        double[] out = new double[SignalType.values().length];
        if (classes.size() == 1) {
            out[classes.get(0).ordinal()] = 1.0;
            return out;
        }
        double[] logits = new double[classes.size()];
        double[] probs = new double[classes.size()];
        softmax(weights, bias, row, logits, probs);
        for (int c = 0; c < classes.size(); c++) {
            out[classes.get(c).ordinal()] = probs[c];
        }
        return out;
    }

    /**
     * Normalized mean absolute coefficient per input column; all zero when every coefficient is zero.
     */
    double[] featureImportances() {
        int d = weights.length == 0 ? 0 : weights[0].length;
        double[] importance = new double[d];
        double total = 0.0;
        for (int j = 0; j < d; j++) {
            double sum = 0.0;
            for (double[] classWeights : weights) {
                sum += Math.abs(classWeights[j]);
            }
            importance[j] = sum / weights.length;
            total += importance[j];
        }
        if (total > 0.0) {
            for (int j = 0; j < d; j++) {
                importance[j] /= total;
            }
        }
        return importance;
    }

    List<SignalType> classes() {
        return classes;
    }

    private static void softmax(double[][] w, double[] b, double[] x, double[] logits, double[] probs) {
        double max = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < w.length; c++) {
            double z = b[c];
            for (int j = 0; j < x.length; j++) {
                z += w[c][j] * x[j];
            }
            logits[c] = z;
            max = Math.max(max, z);
        }
        double sum = 0.0;
        for (int c = 0; c < w.length; c++) {
            probs[c] = Math.exp(logits[c] - max);
            sum += probs[c];
        }
        for (int c = 0; c < w.length; c++) {
            probs[c] /= sum;
        }
    }
}
