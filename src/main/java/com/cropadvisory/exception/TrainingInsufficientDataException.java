package com.cropadvisory.exception;

public class TrainingInsufficientDataException extends AdvisoryException {
    public TrainingInsufficientDataException(int available, int required) {
        super("TRAINING_INSUFFICIENT_DATA",
              "Insufficient training data: " + available + " samples (need " + required + "+)");
    }
}
