package com.cropadvisory.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a background retraining run. {@code report} is present once the
 * run completed, {@code failureReason} once it failed.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AsyncJobResponse {
    UUID jobId;
    String jobType;
    AsyncJobStatus status;
    String requestId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant submittedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant finishedAt;
    String failureReason;
    TrainingReport report;
}
