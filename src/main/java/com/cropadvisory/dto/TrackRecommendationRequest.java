package com.cropadvisory.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class TrackRecommendationRequest {

    @NotBlank(message = "location is required")
    String location;

    Double latitude;
    Double longitude;
    String season;
    String soilType;
    WeatherSnapshot weather;

    @Builder.Default
    List<String> crops = List.of();
}
