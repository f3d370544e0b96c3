package com.triage.service.anomaly;

/**
 * Per-dimension standardization learned from a training matrix.
 * Constant dimensions keep a unit scale so they map to zero.
 */
final class FeatureScaler {

    private final double[] mean;
    private final double[] scale;

    private FeatureScaler(double[] mean, double[] scale) {
        this.mean = mean;
        this.scale = scale;
    }

    static FeatureScaler fit(double[][] data) {
        int dimension = data[0].length;
        double[] mean = new double[dimension];
        double[] scale = new double[dimension];

        for (double[] row : data) {
            for (int j = 0; j < dimension; j++) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < dimension; j++) {
            mean[j] /= data.length;
        }

        for (double[] row : data) {
            for (int j = 0; j < dimension; j++) {
                double d = row[j] - mean[j];
                scale[j] += d * d;
            }
        }
        for (int j = 0; j < dimension; j++) {
            double std = Math.sqrt(scale[j] / data.length);
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

    double[][] transform(double[][] data) {
        double[][] out = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            out[i] = transform(data[i]);
        }
        return out;
    }

    int dimension() {
        return mean.length;
    }
}
