package com.cropadvisory.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CurrentConditions {

    public static final String REAL_TIME = "real-time";
    public static final String FALLBACK = "fallback";

    WeatherSnapshot weather;
    @Builder.Default
    Map<String, Object> marketPrices = Map.of();
    @Builder.Default
    Map<String, Object> soilHealth = Map.of();
    String soilType;
    String weatherSource;
    String marketSource;
    String soilSource;

    public String getDataSource() {
        return REAL_TIME.equals(weatherSource) ? REAL_TIME : FALLBACK;
    }
}
