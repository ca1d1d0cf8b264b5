package com.cropadvisory.service;

import com.cropadvisory.dto.DailyForecast;
import com.cropadvisory.dto.ForecastAnalysis;
import com.cropadvisory.dto.ForecastSummary;
import com.cropadvisory.knowledge.CropKnowledgeBase;
import com.cropadvisory.knowledge.CropProfile;
import com.cropadvisory.knowledge.WaterRequirement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Scores a short-range daily forecast against a crop's temperature band and water
 * requirement. Scores are on a 0-20 scale; 10 is neutral.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastAnalyzer {

    static final double NEUTRAL_SCORE = 10.0;
    static final double MAX_SCORE = 20.0;
    static final double FULL_FORECAST_CONFIDENCE = 0.85;
    static final double PARTIAL_FORECAST_CONFIDENCE = 0.65;
    static final double NO_FORECAST_CONFIDENCE = 0.5;
    static final int FULL_FORECAST_DAYS = 5;
    static final double EXTREME_HEAT_C = 40.0;
    static final double FROST_C = 5.0;
    static final double DEFAULT_DAY_TEMPERATURE = 25.0;

    static final String STORM_WARNING = "Storm predicted - may damage crops";
    static final String HEAT_WARNING = "Extreme heat predicted - ensure adequate irrigation";
    static final String FROST_WARNING = "Frost risk - protect sensitive crops";
    static final String HEAVY_RAIN_WARNING = "Heavy rainfall predicted - ensure drainage";

    private final CropKnowledgeBase knowledgeBase;

    public ForecastSummary summarize(List<DailyForecast> forecast) {
        List<DailyForecast> days = nonNull(forecast);
        if (days.isEmpty()) {
            return ForecastSummary.builder()
                .rainyDays(0)
                .forecastDays(0)
                .status(ForecastSummary.NO_FORECAST)
                .build();
        }
        DoubleSummaryStatistics temps = temperatures(days);
        return ForecastSummary.builder()
            .avgTemperature(round1(temps.getAverage()))
            .minTemperature(round1(temps.getMin()))
            .maxTemperature(round1(temps.getMax()))
            .rainyDays(rainyDays(days))
            .forecastDays(days.size())
            .status(ForecastSummary.AVAILABLE)
            .build();
    }

    public ForecastAnalysis analyzeForecast(List<DailyForecast> forecast, String crop) {
        List<DailyForecast> days = nonNull(forecast);
        if (days.isEmpty()) {
            return ForecastAnalysis.builder()
                .suitabilityScore(NEUTRAL_SCORE)
                .status(ForecastSummary.NO_FORECAST)
                .advice(List.of("Weather forecast unavailable"))
                .confidence(NO_FORECAST_CONFIDENCE)
                .build();
        }

        CropProfile profile = knowledgeBase.profileOrGeneric(crop);
        ForecastAnalysis.TemperatureAnalysis temperature = analyzeTemperature(days, profile);
        ForecastAnalysis.RainfallAnalysis rainfall = analyzeRainfall(days, profile.waterRequirement());
        double score = clamp((temperature.getScore() + rainfall.getScore()) / 2.0, 0.0, MAX_SCORE);

        ForecastAnalysis analysis = ForecastAnalysis.builder()
            .suitabilityScore(round1(score))
            .status(ForecastSummary.AVAILABLE)
            .temperature(temperature)
            .rainfall(rainfall)
            .warnings(warnings(days))
            .advice(advice(profile.name(), temperature, rainfall))
            .confidence(days.size() >= FULL_FORECAST_DAYS ? FULL_FORECAST_CONFIDENCE : PARTIAL_FORECAST_CONFIDENCE)
            .build();
        log.debug("Forecast analysed | crop={} | score={} | temp={} | rain={} | days={}",
            profile.name(), analysis.getSuitabilityScore(), temperature.getStatus(), rainfall.getStatus(), days.size());
        return analysis;
    }

    ForecastAnalysis.TemperatureAnalysis analyzeTemperature(List<DailyForecast> days, CropProfile profile) {
        DoubleSummaryStatistics temps = temperatures(days);
        double avg = temps.getAverage();
        double score;
        String status;
        if (avg >= profile.minTemp() && avg <= profile.maxTemp()) {
            score = clamp(MAX_SCORE - 2.0 * Math.abs(avg - profile.optimalTemp()), NEUTRAL_SCORE, MAX_SCORE);
            status = score >= 18.0 ? "optimal" : "suitable";
        } else if (avg < profile.minTemp()) {
            score = Math.max(0.0, NEUTRAL_SCORE - 3.0 * (profile.minTemp() - avg));
            status = "too_cold";
        } else {
            score = Math.max(0.0, NEUTRAL_SCORE - 3.0 * (avg - profile.maxTemp()));
            status = "too_hot";
        }
        return ForecastAnalysis.TemperatureAnalysis.builder()
            .score(round1(score))
            .avgTemp(round1(avg))
            .minTemp(round1(temps.getMin()))
            .maxTemp(round1(temps.getMax()))
            .optimalTemp(profile.optimalTemp())
            .status(status)
            .build();
    }

    ForecastAnalysis.RainfallAnalysis analyzeRainfall(List<DailyForecast> days, WaterRequirement requirement) {
        int rainy = rainyDays(days);
        WaterRequirement water = requirement != null ? requirement : WaterRequirement.MODERATE;
        double score;
        String status;
        switch (water) {
            case HIGH -> {
                if (rainy >= 4) {
                    score = 20;
                    status = "excellent";
                } else if (rainy >= 2) {
                    score = 15;
                    status = "good";
                } else {
                    score = 8;
                    status = "needs_irrigation";
                }
            }
            case LOW -> {
                if (rainy <= 2) {
                    score = 20;
                    status = "excellent";
                } else if (rainy <= 4) {
                    score = 15;
                    status = "acceptable";
                } else {
                    score = 10;
                    status = "excess_moisture";
                }
            }
            default -> {
                if (rainy >= 2 && rainy <= 4) {
                    score = 20;
                    status = "optimal";
                } else if (rainy >= 5) {
                    score = 12;
                    status = "excess_rain_risk";
                } else {
                    score = 14;
                    status = "acceptable";
                }
            }
        }
        return ForecastAnalysis.RainfallAnalysis.builder()
            .score(score)
            .rainyDays(rainy)
            .waterRequirement(water.name().toLowerCase(Locale.ROOT))
            .status(status)
            .build();
    }

    List<String> warnings(List<DailyForecast> days) {
        Set<String> warnings = new LinkedHashSet<>();
        for (DailyForecast day : days) {
            if (day.conditionMatches("storm", "तूफान")) {
                warnings.add(STORM_WARNING);
            }
            double temp = temperatureOf(day);
            if (temp > EXTREME_HEAT_C) {
                warnings.add(HEAT_WARNING);
            } else if (temp < FROST_C) {
                warnings.add(FROST_WARNING);
            }
            if (day.conditionMatches("heavy", "भारी")) {
                warnings.add(HEAVY_RAIN_WARNING);
            }
        }
        return List.copyOf(warnings);
    }

    private static List<String> advice(String crop, ForecastAnalysis.TemperatureAnalysis temperature,
                                       ForecastAnalysis.RainfallAnalysis rainfall) {
        List<String> advice = new ArrayList<>();
        switch (temperature.getStatus()) {
            case "too_cold" -> advice.add("Temperature below optimal - consider delaying sowing");
            case "too_hot" -> advice.add("High temperatures expected - ensure irrigation");
            case "optimal" -> advice.add("Temperature conditions optimal for " + crop);
            default -> { }
        }
        switch (rainfall.getStatus()) {
            case "needs_irrigation" -> advice.add("Low rainfall predicted - arrange irrigation");
            case "excess_rain_risk" -> advice.add("Heavy rainfall expected - ensure proper drainage");
            case "excellent", "optimal" -> advice.add("Rainfall conditions favorable for " + crop);
            default -> { }
        }
        if (temperature.getScore() >= 15 && rainfall.getScore() >= 15) {
            advice.add("Excellent time to sow " + crop);
        } else if (temperature.getScore() < 10 || rainfall.getScore() < 10) {
            advice.add("Consider waiting for better conditions");
        }
        return List.copyOf(advice);
    }

    private static DoubleSummaryStatistics temperatures(List<DailyForecast> days) {
        return days.stream().mapToDouble(ForecastAnalyzer::temperatureOf).summaryStatistics();
    }

    private static double temperatureOf(DailyForecast day) {
        Double t = day.getTemperature();
        return t != null && Double.isFinite(t) ? t : DEFAULT_DAY_TEMPERATURE;
    }

    private static int rainyDays(List<DailyForecast> days) {
        return (int) days.stream().filter(DailyForecast::isRainy).count();
    }

    private static List<DailyForecast> nonNull(List<DailyForecast> forecast) {
        if (forecast == null) {
            return List.of();
        }
        return forecast.stream().filter(Objects::nonNull).toList();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
