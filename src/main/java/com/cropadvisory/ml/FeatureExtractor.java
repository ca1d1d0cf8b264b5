package com.cropadvisory.ml;

import com.cropadvisory.dto.DailyForecast;
import com.cropadvisory.dto.WeatherSnapshot;
import com.cropadvisory.knowledge.Season;
import com.cropadvisory.knowledge.WaterRequirement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link FeatureVector}s. Every slot is filled independently from its own
 * input or a climatological default, so a missing field never invalidates the
 * vector.
 */
@Component
public class FeatureExtractor {

    static final double DEFAULT_TEMPERATURE = 25.0;
    static final double DEFAULT_HUMIDITY = 65.0;
    static final double DEFAULT_LATITUDE = 28.0;
    static final double DEFAULT_LONGITUDE = 77.0;
    static final int DEFAULT_DURATION_DAYS = 120;
    static final double DEFAULT_PROFIT_PER_HECTARE = 50_000.0;
    static final double PROFIT_SCALE = 100_000.0;
    static final int DEFAULT_SOIL_CODE = 6;

    private static final Map<String, Integer> SOIL_CODES = Map.of(
        "black", 1,
        "red", 2,
        "alluvial", 3,
        "sandy", 4,
        "clayey", 5,
        "clay", 5,
        "loamy", 6,
        "loam", 6);

    public FeatureVector extract(CropAttributes crop, WeatherSnapshot weather, GeoPoint location, String soilType) {
        WeatherSnapshot w = weather != null ? weather : WeatherSnapshot.empty();
        GeoPoint geo = location != null ? location : GeoPoint.unknown();

        double current = finiteOr(w.getTemperature(), DEFAULT_TEMPERATURE);
        List<Double> temps = new ArrayList<>();
        temps.add(current);
        double forecastRain = 0.0;
        for (DailyForecast day : w.forecastOrEmpty()) {
            if (day == null) {
                continue;
            }
            if (day.getTemperature() != null && Double.isFinite(day.getTemperature())) {
                temps.add(day.getTemperature());
            }
            double rain = day.estimatedRainfallMm();
            if (Double.isFinite(rain)) {
                forecastRain += rain;
            }
        }

        double[] v = new double[FeatureVector.SIZE];
        v[FeatureVector.TEMP_CURRENT] = current;
        v[FeatureVector.TEMP_AVG_7DAY] = finiteOr(temps.stream().mapToDouble(Double::doubleValue).average().orElse(current), current);
        v[FeatureVector.TEMP_MIN_7DAY] = temps.stream().mapToDouble(Double::doubleValue).min().orElse(current);
        v[FeatureVector.TEMP_MAX_7DAY] = temps.stream().mapToDouble(Double::doubleValue).max().orElse(current);
        v[FeatureVector.HUMIDITY] = finiteOr(w.getHumidity(), DEFAULT_HUMIDITY);
        v[FeatureVector.RAINFALL_CURRENT] = finiteOr(w.currentRainfallEstimateMm(), 0.0);
        v[FeatureVector.RAINFALL_7DAY] = finiteOr(forecastRain, 0.0);
        v[FeatureVector.SOIL_CODE] = soilCode(soilType);
        v[FeatureVector.SEASON_CODE] = seasonOf(crop).code();
        v[FeatureVector.LATITUDE] = finiteOr(geo.latitude(), DEFAULT_LATITUDE);
        v[FeatureVector.LONGITUDE] = finiteOr(geo.longitude(), DEFAULT_LONGITUDE);
        v[FeatureVector.DURATION_DAYS] = crop != null && crop.durationDays() != null && crop.durationDays() > 0
            ? crop.durationDays() : DEFAULT_DURATION_DAYS;
        v[FeatureVector.WATER_REQUIREMENT] = crop != null && crop.waterRequirement() != null
            ? crop.waterRequirement().code() : WaterRequirement.MODERATE.code();
        v[FeatureVector.PROFIT_NORMALIZED] =
            finiteOr(crop != null ? crop.profitPerHectare() : null, DEFAULT_PROFIT_PER_HECTARE) / PROFIT_SCALE;
        return FeatureVector.of(v);
    }

    public static int soilCode(String soilType) {
        if (soilType == null) {
            return DEFAULT_SOIL_CODE;
        }
        return SOIL_CODES.getOrDefault(soilType.trim().toLowerCase(Locale.ROOT), DEFAULT_SOIL_CODE);
    }

    private static Season seasonOf(CropAttributes crop) {
        return crop != null && crop.season() != null ? crop.season() : Season.KHARIF;
    }

    private static double finiteOr(Double value, double fallback) {
        return value != null && Double.isFinite(value) ? value : fallback;
    }
}
