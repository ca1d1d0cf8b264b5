package com.cropadvisory.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.Locale;

@Value
@Builder
@Jacksonized
public class DailyForecast {

    static final double RAINY_DAY_ESTIMATE_MM = 5.0;

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    Double temperature;
    String condition;
    Double rainfallMm;

    @JsonIgnore
    public boolean isRainy() {
        if (rainfallMm != null && rainfallMm > 0.0) {
            return true;
        }
        return conditionMatches("rain", "shower", "बारिश");
    }

    /** Reported rainfall, or a flat per-day estimate when only the condition says rain. */
    @JsonIgnore
    public double estimatedRainfallMm() {
        if (rainfallMm != null) {
            return Math.max(0.0, rainfallMm);
        }
        return isRainy() ? RAINY_DAY_ESTIMATE_MM : 0.0;
    }

    @JsonIgnore
    public boolean conditionMatches(String... fragments) {
        if (condition == null) {
            return false;
        }
        String normalized = condition.toLowerCase(Locale.ROOT);
        for (String fragment : fragments) {
            if (normalized.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
