package com.cropadvisory.service;

import com.cropadvisory.dto.PerformanceSnapshot;
import org.springframework.stereotype.Component;

/**
 * Composite score and confidence label for one candidate crop.
 *
 * <p>Composite = 60% of the baseline suitability, plus up to 15 points of
 * historical success, up to 20 points of forecast suitability and up to 15 points
 * of predicted success probability.
 */
@Component
public class CompositeScorer {

    static final double BASELINE_WEIGHT = 0.60;
    static final double HISTORY_POINTS = 15.0;
    static final double NEUTRAL_HISTORY_POINTS = 7.5;
    static final double ML_POINTS = 15.0;
    static final double MAX_WEATHER_POINTS = 20.0;
    static final long MIN_ATTEMPTS_FOR_HISTORY = 3;
    static final long WELL_OBSERVED_ATTEMPTS = 10;
    static final double THRESHOLD_TOLERANCE = 1e-9;

    public static final String VERY_HIGH = "Very High";
    public static final String HIGH = "High";
    public static final String MEDIUM = "Medium";
    public static final String LOW = "Low";

    public double compositeScore(double baselineSuitability, PerformanceSnapshot history,
                                 double weatherScore, double successProbability) {
        double hist = attempts(history) >= MIN_ATTEMPTS_FOR_HISTORY
            ? history.getSuccessRate() * HISTORY_POINTS
            : NEUTRAL_HISTORY_POINTS;
        double weather = weatherScore > MAX_WEATHER_POINTS ? weatherScore / 2.0 : weatherScore;
        double ml = successProbability * ML_POINTS;
        return round(baselineSuitability * BASELINE_WEIGHT + hist + weather + ml, 1);
    }

    public double confidenceScore(PerformanceSnapshot history, double successProbability, boolean forecastHighConfidence) {
        double score = 0.2;
        long attempts = attempts(history);
        if (attempts >= WELL_OBSERVED_ATTEMPTS) {
            score += 0.3;
        } else if (attempts >= MIN_ATTEMPTS_FOR_HISTORY) {
            score += 0.15;
        }
        if (successProbability >= 0.8) {
            score += 0.3;
        } else if (successProbability >= 0.6) {
            score += 0.2;
        } else {
            score += 0.1;
        }
        score += forecastHighConfidence ? 0.2 : 0.1;
        return score;
    }

    public String confidenceLabel(PerformanceSnapshot history, double successProbability, boolean forecastHighConfidence) {
        return labelFor(confidenceScore(history, successProbability, forecastHighConfidence));
    }

    /**
     * Maps a confidence score to its label. Thresholds are compared with a small
     * tolerance so a sum of weights that should land on a threshold still does.
     */
    String labelFor(double confidenceScore) {
        if (atLeast(confidenceScore, 0.8)) {
            return VERY_HIGH;
        }
        if (atLeast(confidenceScore, 0.65)) {
            return HIGH;
        }
        if (atLeast(confidenceScore, 0.5)) {
            return MEDIUM;
        }
        return LOW;
    }

    private static boolean atLeast(double score, double threshold) {
        return score >= threshold - THRESHOLD_TOLERANCE;
    }

    private static long attempts(PerformanceSnapshot history) {
        return history == null ? 0 : history.getTotalAttempts();
    }

    static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
