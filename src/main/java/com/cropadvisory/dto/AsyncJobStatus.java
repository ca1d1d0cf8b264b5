package com.cropadvisory.dto;

public enum AsyncJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
