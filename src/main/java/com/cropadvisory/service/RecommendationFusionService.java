package com.cropadvisory.service;

import com.cropadvisory.client.BaseRecommendationClient;
import com.cropadvisory.client.GovernmentDataClient;
import com.cropadvisory.dto.CropCandidate;
import com.cropadvisory.dto.CurrentConditions;
import com.cropadvisory.dto.DailyForecast;
import com.cropadvisory.dto.EnhancedRecommendation;
import com.cropadvisory.dto.EnhancedRecommendationResponse;
import com.cropadvisory.dto.ForecastAnalysis;
import com.cropadvisory.dto.ForecastSummary;
import com.cropadvisory.dto.PerformanceSnapshot;
import com.cropadvisory.dto.Predictions;
import com.cropadvisory.dto.RangeEstimate;
import com.cropadvisory.dto.RecommendationQuery;
import com.cropadvisory.dto.TrackRecommendationRequest;
import com.cropadvisory.dto.WeatherSnapshot;
import com.cropadvisory.entity.PerformanceAggregate;
import com.cropadvisory.exception.DataUnavailableException;
import com.cropadvisory.knowledge.CropKnowledgeBase;
import com.cropadvisory.knowledge.CropProfile;
import com.cropadvisory.knowledge.Season;
import com.cropadvisory.knowledge.WaterRequirement;
import com.cropadvisory.ml.CropAttributes;
import com.cropadvisory.ml.FeatureExtractor;
import com.cropadvisory.ml.FeatureVector;
import com.cropadvisory.ml.GeoPoint;
import com.cropadvisory.ml.PredictiveModelEnsemble;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Builds the ranked, confidence-labelled recommendation list for one request by
 * combining live conditions, outcome history, forecast suitability, model
 * predictions and the baseline provider's candidates.
 *
 * <p>Only a missing baseline is fatal. Every other input has a fallback, and a
 * failure while enhancing one candidate degrades that candidate to its baseline
 * score instead of failing the request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationFusionService {

    public static final int MAX_RECOMMENDATIONS = 8;
    static final int STATISTICAL_FALLBACK_ATTEMPTS = 5;
    static final String DEFAULT_SOIL_TYPE = "loamy";

    static final String METHOD_MODEL = "ml-model";
    static final String METHOD_HISTORICAL = "historical";
    static final String METHOD_UNTRAINED = "untrained-default";

    private final GovernmentDataClient governmentDataClient;
    private final BaseRecommendationClient baseRecommendationClient;
    private final OutcomeStoreService outcomeStore;
    private final ForecastAnalyzer forecastAnalyzer;
    private final PredictiveModelEnsemble ensemble;
    private final FeatureExtractor featureExtractor;
    private final MarketOutlookCalculator marketOutlookCalculator;
    private final CompositeScorer scorer;
    private final CropKnowledgeBase knowledgeBase;
    private final Clock clock;

    @Value("${advisory.gateway.timeout-seconds:5}")
    private int gatewayTimeoutSeconds = 5;

    @Value("${advisory.base-provider.timeout-seconds:10}")
    private int baseProviderTimeoutSeconds = 10;

    public EnhancedRecommendationResponse getEnhancedRecommendations(RecommendationQuery query) {
        String location = query.getLocation().trim();
        log.info("Enhanced recommendations requested | location={} | soilType={} | season={}",
            location, query.getSoilType(), query.getSeason());

        CurrentConditions conditions = fetchCurrentConditions(query);
        String season = resolveSeason(query.getSeason());
        String soilType = resolveSoilType(query.getSoilType(), conditions);
        WeatherSnapshot weather = conditions.getWeather();
        List<DailyForecast> forecast = weather.forecastOrEmpty();

        Map<String, PerformanceSnapshot> history = outcomeStore.getLocationPerformance(location, season);
        ForecastSummary forecastSummary = forecastAnalyzer.summarize(forecast);
        List<CropCandidate> candidates = fetchCandidates(query, location, soilType, season);

        Request request = new Request(location, season, soilType, new GeoPoint(query.getLatitude(), query.getLongitude()),
            weather, forecast, history, conditions.getDataSource(),
            CurrentConditions.REAL_TIME.equals(conditions.getMarketSource()) && !conditions.getMarketPrices().isEmpty());

        List<EnhancedRecommendation> ranked = candidates.stream()
            .map(candidate -> enhanceOrBaseline(candidate, request))
            .sorted(Comparator.comparingDouble(EnhancedRecommendation::getEnhancedScore).reversed())
            .limit(MAX_RECOMMENDATIONS)
            .toList();

        String recommendationId = outcomeStore.trackRecommendation(TrackRecommendationRequest.builder()
            .location(location)
            .latitude(query.getLatitude())
            .longitude(query.getLongitude())
            .season(season)
            .soilType(soilType)
            .weather(weather)
            .crops(ranked.stream().map(EnhancedRecommendation::getCrop).toList())
            .build());

        log.info("Enhanced recommendations ready | location={} | season={} | candidates={} | returned={} | weather={} | recommendationId={}",
            location, season, candidates.size(), ranked.size(), conditions.getWeatherSource(), recommendationId);

        return EnhancedRecommendationResponse.builder()
            .recommendationId(recommendationId)
            .location(location)
            .season(season)
            .soilType(soilType)
            .recommendations(ranked)
            .currentConditions(conditions)
            .forecastSummary(forecastSummary)
            .dataSources(dataSources(conditions, history))
            .timestamp(Instant.now(clock))
            .build();
    }

    CurrentConditions fetchCurrentConditions(RecommendationQuery query) {
        Duration timeout = Duration.ofSeconds(gatewayTimeoutSeconds);
        String location = query.getLocation();
        Double lat = query.getLatitude();
        Double lon = query.getLongitude();

        Mono<Feed<WeatherSnapshot>> weather = live(
            () -> governmentDataClient.getWeatherData(location, lat, lon), timeout, WeatherSnapshot.empty(), "weather");
        Mono<Feed<Map<String, Object>>> market = live(
            () -> governmentDataClient.getMarketPrices(location, lat, lon), timeout, Map.of(), "market");
        Mono<Feed<Map<String, Object>>> soil = live(
            () -> governmentDataClient.getSoilHealthData(location, lat, lon), timeout, Map.of(), "soil");

        Feeds feeds;
        try {
            feeds = Mono.zip(weather, market, soil)
                .map(t -> new Feeds(t.getT1(), t.getT2(), t.getT3()))
                .block(timeout.plusSeconds(1));
        } catch (IllegalStateException ex) {
            log.warn("Gateway fetch did not complete in time, using fallbacks | location={}", location);
            feeds = null;
        }
        if (feeds == null) {
            feeds = new Feeds(Feed.fallback(WeatherSnapshot.empty()), Feed.fallback(Map.of()), Feed.fallback(Map.of()));
        }

        return CurrentConditions.builder()
            .weather(feeds.weather().value())
            .marketPrices(feeds.market().value())
            .soilHealth(feeds.soil().value())
            .soilType(soilTypeOf(feeds.soil().value()))
            .weatherSource(feeds.weather().source())
            .marketSource(feeds.market().source())
            .soilSource(feeds.soil().source())
            .build();
    }

    private static <T> Mono<Feed<T>> live(Supplier<Mono<T>> call, Duration timeout, T fallback, String feed) {
        return Mono.defer(call)
            .timeout(timeout)
            .map(Feed::live)
            .defaultIfEmpty(Feed.fallback(fallback))
            .onErrorResume(ex -> {
                log.warn("Using fallback {} data | reason={}", feed, ex.getMessage());
                return Mono.just(Feed.fallback(fallback));
            });
    }

    private List<CropCandidate> fetchCandidates(RecommendationQuery query, String location, String soilType, String season) {
        try {
            List<CropCandidate> candidates = baseRecommendationClient
                .getRecommendations(location, soilType, season, query.getLatitude(), query.getLongitude())
                .block(Duration.ofSeconds(baseProviderTimeoutSeconds).plusSeconds(1));
            if (candidates == null || candidates.isEmpty()) {
                throw new DataUnavailableException("Base recommendation provider returned no candidates for " + location);
            }
            return candidates;
        } catch (DataUnavailableException ex) {
            log.error("Base recommendations unavailable | location={} | reason={}", location, ex.getMessage());
            throw ex;
        } catch (IllegalStateException ex) {
            log.error("Base recommendations timed out | location={}", location);
            throw new DataUnavailableException("Base recommendation provider timed out for " + location, ex);
        }
    }

    private EnhancedRecommendation enhanceOrBaseline(CropCandidate candidate, Request request) {
        try {
            return enhance(candidate, request);
        } catch (RuntimeException ex) {
            log.warn("Candidate enhancement failed, using baseline | crop={} | reason={}",
                candidate.getCrop(), ex.getMessage(), ex);
            return baselineOnly(candidate);
        }
    }

    EnhancedRecommendation enhance(CropCandidate candidate, Request request) {
        String crop = candidate.getCrop();
        CropProfile profile = knowledgeBase.profileOrGeneric(crop);
        PerformanceSnapshot history = request.history().get(PerformanceAggregate.normalize(crop));
        ForecastAnalysis weatherAnalysis = forecastAnalyzer.analyzeForecast(request.forecast(), crop);

        double baseYield = candidate.getYieldPerHectare() > 0 ? candidate.getYieldPerHectare() : profile.yieldPerHectare();
        double baseProfit = candidate.getProfitPerHectare() > 0 ? candidate.getProfitPerHectare() : profile.profitPerHectare();
        CropAttributes attributes = new CropAttributes(
            Season.parse(candidate.getSeason()).orElse(profile.season()),
            candidate.getDurationDays() > 0 ? candidate.getDurationDays() : profile.durationDays(),
            candidate.getWaterRequirement() != null
                ? WaterRequirement.parse(candidate.getWaterRequirement()) : profile.waterRequirement(),
            baseProfit);
        FeatureVector features = featureExtractor.extract(attributes, request.weather(), request.geo(), request.soilType());

        double successProbability;
        double expectedYield;
        double expectedProfit;
        String method;
        if (ensemble.isTrained()) {
            successProbability = ensemble.predictSuccess(features);
            expectedYield = ensemble.predictYield(features, baseYield);
            expectedProfit = ensemble.predictProfit(features, baseProfit);
            method = METHOD_MODEL;
        } else if (history != null && history.getTotalAttempts() >= STATISTICAL_FALLBACK_ATTEMPTS) {
            successProbability = history.getSuccessRate();
            expectedYield = history.getAvgYield();
            expectedProfit = history.getAvgProfit();
            method = METHOD_HISTORICAL;
        } else {
            successProbability = ensemble.predictSuccess(features);
            expectedYield = ensemble.predictYield(features, baseYield);
            expectedProfit = ensemble.predictProfit(features, baseProfit);
            method = METHOD_UNTRAINED;
        }

        Predictions predictions = Predictions.builder()
            .successProbability(CompositeScorer.round(successProbability, 3))
            .yield(RangeEstimate.builder()
                .expected(CompositeScorer.round(expectedYield, 1))
                .optimistic(CompositeScorer.round(expectedYield * 1.2, 1))
                .pessimistic(CompositeScorer.round(expectedYield * 0.8, 1))
                .unit("quintals/hectare")
                .build())
            .profit(RangeEstimate.builder()
                .expected(Math.round(expectedProfit))
                .optimistic(Math.round(expectedProfit * 1.3))
                .pessimistic(Math.round(expectedProfit * 0.7))
                .unit("INR/hectare")
                .build())
            .marketPrice(marketOutlookCalculator.project(
                crop, candidate.getMspPerQuintal(), request.location(), request.liveMarketData()))
            .method(method)
            .dataSource(request.dataSource())
            .build();

        return EnhancedRecommendation.builder()
            .crop(crop)
            .suitabilityScore(candidate.getSuitabilityScore())
            .yieldPerHectare(candidate.getYieldPerHectare())
            .profitPerHectare(candidate.getProfitPerHectare())
            .mspPerQuintal(candidate.getMspPerQuintal())
            .durationDays(candidate.getDurationDays())
            .season(candidate.getSeason())
            .enhancedScore(scorer.compositeScore(candidate.getSuitabilityScore(), history,
                weatherAnalysis.getSuitabilityScore(), successProbability))
            .historicalPerformance(history)
            .weatherForecastAnalysis(weatherAnalysis)
            .predictions(predictions)
            .confidenceLevel(scorer.confidenceLabel(history, successProbability, weatherAnalysis.isHighConfidence()))
            .baselineOnly(false)
            .build();
    }

    static EnhancedRecommendation baselineOnly(CropCandidate candidate) {
        return EnhancedRecommendation.builder()
            .crop(candidate.getCrop())
            .suitabilityScore(candidate.getSuitabilityScore())
            .yieldPerHectare(candidate.getYieldPerHectare())
            .profitPerHectare(candidate.getProfitPerHectare())
            .mspPerQuintal(candidate.getMspPerQuintal())
            .durationDays(candidate.getDurationDays())
            .season(candidate.getSeason())
            .enhancedScore(candidate.getSuitabilityScore())
            .confidenceLevel(CompositeScorer.LOW)
            .baselineOnly(true)
            .build();
    }

    String resolveSeason(String requested) {
        if (requested != null && !requested.isBlank()) {
            return Season.canonicalKey(requested);
        }
        return Season.forMonth(LocalDate.now(clock).getMonth()).key();
    }

    static String resolveSoilType(String requested, CurrentConditions conditions) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim().toLowerCase(Locale.ROOT);
        }
        return conditions.getSoilType() != null ? conditions.getSoilType() : DEFAULT_SOIL_TYPE;
    }

    private static String soilTypeOf(Map<String, Object> soilHealth) {
        Object type = soilHealth.get("type");
        if (type == null) {
            type = soilHealth.get("soil_type");
        }
        return type == null || type.toString().isBlank() ? DEFAULT_SOIL_TYPE : type.toString().trim().toLowerCase(Locale.ROOT);
    }

    private Map<String, String> dataSources(CurrentConditions conditions, Map<String, PerformanceSnapshot> history) {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("weather", conditions.getWeatherSource());
        sources.put("market", conditions.getMarketSource());
        sources.put("soil", conditions.getSoilSource());
        sources.put("historical", history.isEmpty() ? "none" : "outcome-store");
        sources.put("predictions", ensemble.isTrained() ? METHOD_MODEL : "statistical");
        return sources;
    }

    record Request(String location, String season, String soilType, GeoPoint geo, WeatherSnapshot weather,
                   List<DailyForecast> forecast, Map<String, PerformanceSnapshot> history, String dataSource,
                   boolean liveMarketData) {}

    private record Feed<T>(T value, String source) {
        static <T> Feed<T> live(T value) {
            return new Feed<>(value, CurrentConditions.REAL_TIME);
        }

        static <T> Feed<T> fallback(T value) {
            return new Feed<>(value, CurrentConditions.FALLBACK);
        }
    }

    private record Feeds(Feed<WeatherSnapshot> weather, Feed<Map<String, Object>> market, Feed<Map<String, Object>> soil) {}
}
