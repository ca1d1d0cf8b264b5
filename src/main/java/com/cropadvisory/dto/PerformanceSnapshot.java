package com.cropadvisory.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PerformanceSnapshot {
    String location;
    String crop;
    String season;
    long totalAttempts;
    long successfulAttempts;
    double successRate;
    double avgYield;
    double avgProfit;
    String dataQuality;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant lastUpdated;
}
