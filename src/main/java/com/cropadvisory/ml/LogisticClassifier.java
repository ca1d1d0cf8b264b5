package com.cropadvisory.ml;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.StatUtils;

/**
 * L2-regularised logistic regression over standardised features, fitted with
 * full-batch gradient descent.
 */
public record LogisticClassifier(double[] weights, double intercept) {

    public static LogisticClassifier fit(double[][] x, double[] y, int iterations, double learningRate, double l2) {
        RealMatrix features = new Array2DRowRealMatrix(x, false);
        RealMatrix transposed = features.transpose();
        RealVector labels = new ArrayRealVector(y, false);
        int n = x.length;

        RealVector w = new ArrayRealVector(features.getColumnDimension());
        double b = 0.0;
        for (int iter = 0; iter < iterations; iter++) {
            RealVector logits = features.operate(w).mapAdd(b);
            RealVector residual = logits.map(LogisticClassifier::sigmoid).subtract(labels);
            RealVector gradW = transposed.operate(residual).mapDivide(n).add(w.mapMultiply(l2));
            double gradB = StatUtils.sum(residual.toArray()) / n;
            w = w.subtract(gradW.mapMultiply(learningRate));
            b -= learningRate * gradB;
        }
        return new LogisticClassifier(w.toArray(), b);
    }

    public double probability(double[] scaledRow) {
        double z = intercept;
        for (int i = 0; i < weights.length; i++) {
            z += weights[i] * scaledRow[i];
        }
        return sigmoid(z);
    }

    static double sigmoid(double z) {
        return 1.0 / (1.0 + Math.exp(-z));
    }
}
