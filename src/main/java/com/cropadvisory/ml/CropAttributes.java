package com.cropadvisory.ml;

import com.cropadvisory.knowledge.Season;
import com.cropadvisory.knowledge.WaterRequirement;

/**
 * Crop-side inputs to feature extraction. Any component may be null.
 */
public record CropAttributes(
    Season season,
    Integer durationDays,
    WaterRequirement waterRequirement,
    Double profitPerHectare
) {}
