package com.cropadvisory.ml;

import com.cropadvisory.exception.TrainingInsufficientDataException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Fits a complete {@link ModelSet} from joined outcome history. Pure: it holds no
 * state and publishes nothing.
 */
@Component
public class ModelTrainer {

    public static final int DEFAULT_MIN_SAMPLES = 50;

    @Value("${advisory.ml.min-training-samples:50}")
    private int minSamples = DEFAULT_MIN_SAMPLES;

    @Value("${advisory.ml.classifier.iterations:500}")
    private int iterations = 500;

    @Value("${advisory.ml.classifier.learning-rate:0.1}")
    private double learningRate = 0.1;

    @Value("${advisory.ml.classifier.l2:0.01}")
    private double l2 = 0.01;

    @Value("${advisory.ml.regressor.lambda:1.0}")
    private double ridgeLambda = 1.0;

    public ModelSet fit(List<TrainingSample> samples, long version, Instant trainedAt) {
        if (samples == null || samples.size() < minSamples) {
            throw new TrainingInsufficientDataException(samples == null ? 0 : samples.size(), minSamples);
        }
        int n = samples.size();
        double[][] raw = new double[n][];
        double[] success = new double[n];
        double[] yields = new double[n];
        double[] profits = new double[n];
        for (int i = 0; i < n; i++) {
            TrainingSample sample = samples.get(i);
            raw[i] = sample.features().toArray();
            success[i] = sample.outcome().success() ? 1.0 : 0.0;
            yields[i] = sample.outcome().yield();
            profits[i] = sample.outcome().profit();
        }

        FeatureScaler scaler = FeatureScaler.fit(raw);
        double[][] x = scaler.transform(raw);
        LogisticClassifier classifier = LogisticClassifier.fit(x, success, iterations, learningRate, l2);
        RidgeRegressor yieldModel = RidgeRegressor.fit(x, yields, ridgeLambda);
        RidgeRegressor profitModel = RidgeRegressor.fit(x, profits, ridgeLambda);

        ModelSet.TrainingMetrics metrics = new ModelSet.TrainingMetrics(
            accuracy(classifier, x, success), rmse(yieldModel, x, yields), rmse(profitModel, x, profits));
        return new ModelSet(version, trainedAt, n, scaler, classifier, yieldModel, profitModel, metrics);
    }

    public int getMinSamples() {
        return minSamples;
    }

    private static double accuracy(LogisticClassifier classifier, double[][] x, double[] labels) {
        int correct = 0;
        for (int i = 0; i < x.length; i++) {
            double predicted = classifier.probability(x[i]) >= 0.5 ? 1.0 : 0.0;
            if (predicted == labels[i]) {
                correct++;
            }
        }
        return (double) correct / x.length;
    }

    private static double rmse(RidgeRegressor model, double[][] x, double[] targets) {
        double squared = 0.0;
        for (int i = 0; i < x.length; i++) {
            double error = model.predict(x[i]) - targets[i];
            squared += error * error;
        }
        return Math.sqrt(squared / x.length);
    }
}
