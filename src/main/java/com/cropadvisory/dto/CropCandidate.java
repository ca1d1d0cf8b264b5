package com.cropadvisory.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One baseline candidate as returned by the base recommendation provider.
 */
@Value
@Builder
public class CropCandidate {
    String crop;
    double suitabilityScore;
    double yieldPerHectare;
    double profitPerHectare;
    double mspPerQuintal;
    int durationDays;
    String season;
    String waterRequirement;
    @Builder.Default
    Map<String, Object> attributes = Map.of();
}
