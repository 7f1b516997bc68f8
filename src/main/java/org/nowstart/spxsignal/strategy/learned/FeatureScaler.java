package org.nowstart.spxsignal.strategy.learned;

/**
 * Zero-mean, unit-variance standardization fitted once on the training rows only.
 * Constant columns keep a unit scale and map to zero.
 */
final class FeatureScaler {

    private final double[] mean;
    private final double[] scale;

    private FeatureScaler(double[] mean, double[] scale) {
        this.mean = mean;
        this.scale = scale;
    }

    static FeatureScaler fit(double[][] rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("cannot fit scaler on zero rows");
        }
        int d = rows[0].length;
        double[] mean = new double[d];
        double[] scale = new double[d];
        for (double[] row : rows) {
            for (int j = 0; j < d; j++) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < d; j++) {
            mean[j] /= rows.length;
        }
        for (double[] row : rows) {
            for (int j = 0; j < d; j++) {
                double diff = row[j] - mean[j];
                scale[j] += diff * diff;
            }
        }
        for (int j = 0; j < d; j++) {
            double std = Math.sqrt(scale[j] / rows.length);
            scale[j] = std > 1e-12 ? std : 1.0;
        }
        return new FeatureScaler(mean, scale);
    }

    double[] transform(double[] row) {
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - mean[j]) / scale[j];
        }
        return out;
    }

    double[][] transform(double[][] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            out[i] = transform(rows[i]);
        }
        return out;
    }

    double[] mean() {
        return mean.clone();
    }
}
