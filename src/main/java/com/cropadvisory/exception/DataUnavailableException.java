package com.cropadvisory.exception;

public class DataUnavailableException extends AdvisoryException {
    public DataUnavailableException(String message) {
        super("DATA_UNAVAILABLE", message);
    }
    public DataUnavailableException(String message, Throwable cause) {
        super("DATA_UNAVAILABLE", message, cause);
    }
}
