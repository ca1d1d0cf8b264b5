package com.cropadvisory.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Locale;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class WeatherSnapshot {
    Double temperature;
    Double humidity;
    String condition;
    Double rainfallMm;
    @Builder.Default
    List<DailyForecast> forecast = List.of();

    public static WeatherSnapshot empty() {
        return WeatherSnapshot.builder().build();
    }

    @JsonIgnore
    public boolean hasForecast() {
        return forecast != null && !forecast.isEmpty();
    }

    @JsonIgnore
    public List<DailyForecast> forecastOrEmpty() {
        return forecast != null ? forecast : List.of();
    }

    @JsonIgnore
    public double currentRainfallEstimateMm() {
        if (rainfallMm != null) {
            return Math.max(0.0, rainfallMm);
        }
        if (condition == null) {
            return 0.0;
        }
        String normalized = condition.toLowerCase(Locale.ROOT);
        return normalized.contains("rain") || normalized.contains("बारिश")
            ? DailyForecast.RAINY_DAY_ESTIMATE_MM : 0.0;
    }
}
