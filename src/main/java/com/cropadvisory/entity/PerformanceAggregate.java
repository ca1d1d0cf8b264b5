package com.cropadvisory.entity;

import com.cropadvisory.knowledge.Season;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Locale;

/**
 * Running totals of reported outcomes for one (location, crop, season). Derived
 * rates are always computed from the sums, so the entity never stores a value that
 * could drift from them.
 */
@Entity
@Table(
    name = "performance_aggregates",
    indexes = {
        @Index(name = "idx_perf_location", columnList = "location"),
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(access = AccessLevel.PRIVATE)
public class PerformanceAggregate {

    @Id
    @Column(name = "aggregate_key", length = 200, updatable = false, nullable = false)
    private String key;

    @Column(nullable = false, length = 100, updatable = false)
    private String location;

    @Column(nullable = false, length = 50, updatable = false)
    private String crop;

    @Column(nullable = false, length = 20, updatable = false)
    private String season;

    private long attempts;

    private long successes;

    @Column(name = "yield_sum")
    private double yieldSum;

    @Column(name = "profit_sum")
    private double profitSum;

    @Column(name = "last_updated")
    private Instant lastUpdated;

    @Version
    private Long version;

    public static PerformanceAggregate open(String location, String crop, String season) {
        return PerformanceAggregate.builder()
            .key(keyOf(location, crop, season))
            .location(normalize(location))
            .crop(normalize(crop))
            .season(normalizeSeason(season))
            .build();
    }

    public static String keyOf(String location, String crop, String season) {
        return normalize(location) + "|" + normalize(crop) + "|" + normalizeSeason(season);
    }

    public static String normalize(String value) {
        return value == null || value.isBlank() ? "unknown" : value.trim().toLowerCase(Locale.ROOT);
    }

    public static String normalizeSeason(String season) {
        return normalize(Season.canonicalKey(season));
    }

    /** O(1) incremental update for one reported outcome. */
    public void record(boolean success, double yieldAchieved, double profitRealized, Instant at) {
        attempts += 1;
        if (success) {
            successes += 1;
        }
        yieldSum += yieldAchieved;
        profitSum += profitRealized;
        lastUpdated = at;
    }

    public double getSuccessRate() {
        return attempts == 0 ? 0.0 : Math.min(1.0, (double) successes / attempts);
    }

    public double getAvgYield() {
        return attempts == 0 ? 0.0 : yieldSum / attempts;
    }

    public double getAvgProfit() {
        return attempts == 0 ? 0.0 : profitSum / attempts;
    }
}
