package com.cropadvisory.ml;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Z-score standardisation fitted on the training matrix. Constant columns keep a
 * unit scale so they map to zero instead of dividing by zero.
 */
public record FeatureScaler(double[] means, double[] scales) {

    public static FeatureScaler fit(double[][] rows) {
        int width = rows[0].length;
        double[] means = new double[width];
        double[] scales = new double[width];
        for (int col = 0; col < width; col++) {
            SummaryStatistics stats = new SummaryStatistics();
            for (double[] row : rows) {
                stats.addValue(row[col]);
            }
            means[col] = stats.getMean();
            double std = stats.getN() > 1 ? Math.sqrt(stats.getPopulationVariance()) : 0.0;
            scales[col] = std > 1e-12 ? std : 1.0;
        }
        return new FeatureScaler(means, scales);
    }

    public double[] transform(double[] row) {
        if (row.length != means.length) {
            throw new IllegalArgumentException("Expected " + means.length + " features, got " + row.length);
        }
        double[] scaled = new double[row.length];
        for (int i = 0; i < row.length; i++) {
            scaled[i] = (row[i] - means[i]) / scales[i];
        }
        return scaled;
    }

    public double[][] transform(double[][] rows) {
        double[][] scaled = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            scaled[i] = transform(rows[i]);
        }
        return scaled;
    }

    public int width() {
        return means.length;
    }
}
