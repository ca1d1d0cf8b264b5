package com.cropadvisory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnhancedRecommendation {
    String crop;
    double suitabilityScore;
    double yieldPerHectare;
    double profitPerHectare;
    double mspPerQuintal;
    int durationDays;
    String season;
    double enhancedScore;
    PerformanceSnapshot historicalPerformance;
    ForecastAnalysis weatherForecastAnalysis;
    Predictions predictions;
    String confidenceLevel;
    boolean baselineOnly;
}
