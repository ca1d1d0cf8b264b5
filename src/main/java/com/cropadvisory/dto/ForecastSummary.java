package com.cropadvisory.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ForecastSummary {
    public static final String AVAILABLE = "available";
    public static final String NO_FORECAST = "no_forecast";

    Double avgTemperature;
    Double minTemperature;
    Double maxTemperature;
    int rainyDays;
    int forecastDays;
    String status;
}
