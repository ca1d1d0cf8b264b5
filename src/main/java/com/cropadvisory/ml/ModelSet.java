package com.cropadvisory.ml;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * The classifier, both regressors and their shared scaler, published and persisted
 * as one unit. Instances are never mutated after construction.
 */
public record ModelSet(
    long version,
    Instant trainedAt,
    int sampleCount,
    FeatureScaler scaler,
    LogisticClassifier successModel,
    RidgeRegressor yieldModel,
    RidgeRegressor profitModel,
    TrainingMetrics metrics
) {

    public record TrainingMetrics(double accuracy, double yieldRmse, double profitRmse) {}

    /** True when every component exists and matches the current feature layout. */
    @JsonIgnore
    public boolean isCompatible() {
        return scaler != null && successModel != null && yieldModel != null && profitModel != null && metrics != null
            && scaler.width() == FeatureVector.SIZE
            && successModel.weights() != null && successModel.weights().length == FeatureVector.SIZE
            && yieldModel.coefficients() != null && yieldModel.coefficients().length == FeatureVector.SIZE
            && profitModel.coefficients() != null && profitModel.coefficients().length == FeatureVector.SIZE;
    }
}
