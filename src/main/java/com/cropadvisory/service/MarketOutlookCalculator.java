package com.cropadvisory.service;

import com.cropadvisory.dto.MarketOutlook;
import com.cropadvisory.knowledge.CropKnowledgeBase;
import com.cropadvisory.knowledge.CropProfile;
import com.cropadvisory.knowledge.Season;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Projects a crop's price forward from its support price using seasonal demand
 * multipliers and a regional market adjustment.
 */
@Component
@RequiredArgsConstructor
public class MarketOutlookCalculator {

    static final String REAL_TIME = "real-time";
    static final String ESTIMATED = "estimated";

    private static final Map<Season, double[]> SEASONAL_MULTIPLIERS = Map.of(
        Season.KHARIF, new double[] {1.15, 1.25, 1.35},
        Season.RABI, new double[] {1.08, 1.18, 1.28},
        Season.YEAR_ROUND, new double[] {1.12, 1.22, 1.32});

    private static final Map<String, Double> REGIONAL_MULTIPLIERS = Map.of(
        "delhi", 1.0,
        "mumbai", 1.1,
        "bangalore", 1.05,
        "kolkata", 0.95,
        "chennai", 1.08,
        "hyderabad", 1.02,
        "pune", 1.06,
        "ahmedabad", 0.98,
        "jaipur", 0.92,
        "lucknow", 0.94);

    private final CropKnowledgeBase knowledgeBase;

    /**
     * @param mspPerQuintal support price reported for the candidate; the catalogue price is used when not positive
     * @param liveMarketData whether real market prices were available for this request
     */
    public MarketOutlook project(String crop, double mspPerQuintal, String location, boolean liveMarketData) {
        CropProfile profile = knowledgeBase.profileOrGeneric(crop);
        double base = mspPerQuintal > 0 ? mspPerQuintal : profile.mspPerQuintal();
        double current = base * regionalMultiplier(location);
        double[] multipliers = SEASONAL_MULTIPLIERS.getOrDefault(profile.season(), SEASONAL_MULTIPLIERS.get(Season.YEAR_ROUND));
        String volatility = profile.priceVolatility();

        return MarketOutlook.builder()
            .currentPrice((long) current)
            .nextThreeMonths((long) (current * multipliers[0]))
            .nextSixMonths((long) (current * multipliers[1]))
            .nextYear((long) (current * multipliers[2]))
            .trend(profile.priceTrend())
            .volatility(volatility)
            .confidence("low".equals(volatility) || "medium".equals(volatility) ? "High" : "Medium")
            .dataSource(liveMarketData ? REAL_TIME : ESTIMATED)
            .build();
    }

    static double regionalMultiplier(String location) {
        if (location == null) {
            return 1.0;
        }
        String city = location.split(",")[0].trim().toLowerCase(Locale.ROOT);
        return REGIONAL_MULTIPLIERS.getOrDefault(city, 1.0);
    }
}
