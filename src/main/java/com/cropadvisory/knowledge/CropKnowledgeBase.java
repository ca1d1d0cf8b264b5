package com.cropadvisory.knowledge;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.cropadvisory.knowledge.Season.*;
import static com.cropadvisory.knowledge.WaterRequirement.*;

@Component
public class CropKnowledgeBase {

    static final double DEFAULT_MIN_TEMP = 15.0;
    static final double DEFAULT_OPTIMAL_TEMP = 23.0;
    static final double DEFAULT_MAX_TEMP = 30.0;

    private static final Map<String, CropProfile> PROFILES = Map.ofEntries(
        entry("wheat",     RABI,       120, 45, 2125, 70625,  MODERATE, 10, 20, 25, "increasing", "low"),
        entry("rice",      KHARIF,     150, 40, 1940, 47600,  HIGH,     20, 28, 35, "stable",     "medium"),
        entry("maize",     KHARIF,     100, 35, 1870, 43450,  MODERATE, 18, 25, 32, "increasing", "medium"),
        entry("cotton",    KHARIF,     180, 18, 6080, 69440,  MODERATE, 21, 28, 35, "increasing", "medium"),
        entry("sugarcane", YEAR_ROUND, 365, 700, 315, 160500, HIGH,     20, 28, 35, "stable",     "low"),
        entry("soybean",   KHARIF,     100, 20, 4300, 56000,  MODERATE, 18, 26, 32, "stable",     "medium"),
        entry("potato",    RABI,       100, 250, 1200, 150000, MODERATE, 15, 20, 25, "volatile",  "high"),
        entry("onion",     RABI,       130, 200, 1500, 180000, MODERATE, 13, 20, 27, "volatile",  "very_high"),
        entry("tomato",    YEAR_ROUND, 120, 250, 1200, 170000, MODERATE, 18, 23, 27, "volatile",  "high"),
        entry("mustard",   RABI,       120, 20, 5050, 81000,  LOW,      10, 18, 25, "increasing", "medium"),
        entry("groundnut", KHARIF,     110, 25, 5850, 86250,  LOW,      20, 27, 33, "stable",     "medium"),
        entry("bajra",     KHARIF,      85, 20, 2250, 27000,  LOW,      20, 30, 35, "stable",     "low"),
        entry("jowar",     KHARIF,     110, 25, 2970, 46250,  LOW,      20, 28, 34, "stable",     "low"),
        entry("jute",      KHARIF,     120, 25, 4750, 78750,  HIGH,     24, 30, 37, "stable",     "medium"),
        entry("banana",    YEAR_ROUND, 330, 600, 1000, 360000, HIGH,    20, 27, 35, "stable",     "medium"),
        entry("turmeric",  KHARIF,     240, 60, 7000, 300000, MODERATE, 20, 26, 32, "increasing", "medium"),
        entry("chickpea",  RABI,       110, 15, 5230, 58450,  LOW,      15, 22, 28, "increasing", "medium"),
        entry("watermelon", ZAID,       90, 250, 800, 150000, MODERATE, 22, 28, 35, "volatile",   "high")
    );

    /**
     * Looks up a crop by name, case-insensitively. Returns empty for crops the
     * knowledge base does not cover; callers fall back to {@link #generic(String)}.
     */
    public Optional<CropProfile> find(String crop) {
        if (crop == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(PROFILES.get(crop.trim().toLowerCase(Locale.ROOT)));
    }

    public CropProfile profileOrGeneric(String crop) {
        return find(crop).orElseGet(() -> generic(crop));
    }

    public CropProfile generic(String crop) {
        String name = crop == null ? "unknown" : crop.trim().toLowerCase(Locale.ROOT);
        return new CropProfile(name, KHARIF, 120, 40, 2000, 50000, MODERATE,
            DEFAULT_MIN_TEMP, DEFAULT_OPTIMAL_TEMP, DEFAULT_MAX_TEMP, "stable", "medium");
    }

    private static Map.Entry<String, CropProfile> entry(
            String name, Season season, int duration, double yield, double msp, double profit,
            WaterRequirement water, double minTemp, double optimalTemp, double maxTemp,
            String trend, String volatility) {
        return Map.entry(name, new CropProfile(name, season, duration, yield, msp, profit,
            water, minTemp, optimalTemp, maxTemp, trend, volatility));
    }
}
