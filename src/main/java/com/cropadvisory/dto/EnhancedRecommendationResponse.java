package com.cropadvisory.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class EnhancedRecommendationResponse {
    String recommendationId;
    String location;
    String season;
    String soilType;
    List<EnhancedRecommendation> recommendations;
    CurrentConditions currentConditions;
    ForecastSummary forecastSummary;
    Map<String, String> dataSources;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
}
