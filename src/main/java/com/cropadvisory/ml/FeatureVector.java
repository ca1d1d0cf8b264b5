package com.cropadvisory.ml;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed-order numeric input shared by the classifier and both regressors.
 *
 * <p>Slot order (never reorder; persisted models depend on it):
 * <ol start="0">
 *   <li>current temperature (°C)</li>
 *   <li>7-day mean temperature</li>
 *   <li>7-day minimum temperature</li>
 *   <li>7-day maximum temperature</li>
 *   <li>relative humidity (%)</li>
 *   <li>current rainfall (mm)</li>
 *   <li>7-day forecast rainfall total (mm)</li>
 *   <li>soil code: black=1, red=2, alluvial=3, sandy=4, clayey=5, loamy=6</li>
 *   <li>season code: kharif=1, rabi=2, zaid=3, year_round=4</li>
 *   <li>latitude</li>
 *   <li>longitude</li>
 *   <li>crop duration (days)</li>
 *   <li>water requirement: low=1, moderate=2, high=3</li>
 *   <li>profit per hectare / 100 000</li>
 * </ol>
 */
public final class FeatureVector {

    public static final int TEMP_CURRENT = 0;
    public static final int TEMP_AVG_7DAY = 1;
    public static final int TEMP_MIN_7DAY = 2;
    public static final int TEMP_MAX_7DAY = 3;
    public static final int HUMIDITY = 4;
    public static final int RAINFALL_CURRENT = 5;
    public static final int RAINFALL_7DAY = 6;
    public static final int SOIL_CODE = 7;
    public static final int SEASON_CODE = 8;
    public static final int LATITUDE = 9;
    public static final int LONGITUDE = 10;
    public static final int DURATION_DAYS = 11;
    public static final int WATER_REQUIREMENT = 12;
    public static final int PROFIT_NORMALIZED = 13;

    public static final List<String> NAMES = List.of(
        "temp_current", "temp_avg_7day", "temp_min_7day", "temp_max_7day",
        "humidity", "rainfall_current", "rainfall_7day",
        "soil_code", "season_code", "latitude", "longitude",
        "duration_days", "water_requirement", "profit_normalized");

    public static final int SIZE = NAMES.size();

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    public static FeatureVector of(double... values) {
        if (values == null || values.length != SIZE) {
            throw new IllegalArgumentException("Feature vector requires exactly " + SIZE + " values");
        }
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("Feature vector values must be finite");
            }
        }
        return new FeatureVector(values.clone());
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FeatureVector other && Arrays.equals(values, other.values));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
