package com.cropadvisory.exception;

public class PerformanceNotFoundException extends AdvisoryException {
    public PerformanceNotFoundException(String location, String crop, String season) {
        super("PERFORMANCE_NOT_FOUND",
              "No performance history for crop '" + crop + "' at '" + location + "' in season '" + season + "'.");
    }
}
