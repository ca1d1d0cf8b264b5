package com.cropadvisory.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastAnalysis {

    static final double HIGH_CONFIDENCE = 0.8;

    double suitabilityScore;
    String status;
    TemperatureAnalysis temperature;
    RainfallAnalysis rainfall;
    @Builder.Default
    List<String> warnings = List.of();
    @Builder.Default
    List<String> advice = List.of();
    double confidence;

    @JsonIgnore
    public boolean isHighConfidence() {
        return confidence >= HIGH_CONFIDENCE;
    }

    @Value
    @Builder
    public static class TemperatureAnalysis {
        double score;
        double avgTemp;
        double minTemp;
        double maxTemp;
        double optimalTemp;
        String status;
    }

    @Value
    @Builder
    public static class RainfallAnalysis {
        double score;
        int rainyDays;
        String waterRequirement;
        String status;
    }
}
