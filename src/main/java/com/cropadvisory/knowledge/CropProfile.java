package com.cropadvisory.knowledge;

/**
 * Agronomic reference data for a single crop. Temperatures are in °C, yield in
 * quintals per hectare, money in rupees.
 */
public record CropProfile(
    String name,
    Season season,
    int durationDays,
    double yieldPerHectare,
    double mspPerQuintal,
    double profitPerHectare,
    WaterRequirement waterRequirement,
    double minTemp,
    double optimalTemp,
    double maxTemp,
    String priceTrend,
    String priceVolatility
) {}
