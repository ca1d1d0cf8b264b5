package com.cropadvisory.exception;

import lombok.Getter;

@Getter
public abstract class AdvisoryException extends RuntimeException {
    private final String errorCode;
    protected AdvisoryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected AdvisoryException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
