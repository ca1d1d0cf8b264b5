package com.cropadvisory.ml;

public record TrainingSample(FeatureVector features, Outcome outcome) {

    public record Outcome(boolean success, double yield, double profit) {}
}
