package com.cropadvisory.ml;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Closed-form ridge regression. Inputs must already be centred (the scaler does
 * this), so the intercept is the target mean. The ridge term keeps the normal
 * equations solvable when columns are constant or collinear.
 */
public record RidgeRegressor(double[] coefficients, double intercept) {

    public static RidgeRegressor fit(double[][] x, double[] y, double lambda) {
        RealMatrix features = new Array2DRowRealMatrix(x, false);
        RealMatrix transposed = features.transpose();
        double mean = StatUtils.mean(y);
        RealVector centred = new ArrayRealVector(y).mapSubtract(mean);

        RealMatrix gram = transposed.multiply(features);
        for (int i = 0; i < gram.getRowDimension(); i++) {
            gram.addToEntry(i, i, lambda);
        }
        DecompositionSolver solver = new LUDecomposition(gram).getSolver();
        RealVector beta = solver.solve(transposed.operate(centred));
        return new RidgeRegressor(beta.toArray(), mean);
    }

    public double predict(double[] scaledRow) {
        double value = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            value += coefficients[i] * scaledRow[i];
        }
        return value;
    }
}
