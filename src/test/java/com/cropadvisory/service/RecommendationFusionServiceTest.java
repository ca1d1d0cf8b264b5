package com.cropadvisory.service;

import com.cropadvisory.client.BaseRecommendationClient;
import com.cropadvisory.client.GovernmentDataClient;
import com.cropadvisory.dto.CropCandidate;
import com.cropadvisory.dto.CurrentConditions;
import com.cropadvisory.dto.DailyForecast;
import com.cropadvisory.dto.EnhancedRecommendation;
import com.cropadvisory.dto.EnhancedRecommendationResponse;
import com.cropadvisory.dto.ForecastSummary;
import com.cropadvisory.dto.PerformanceSnapshot;
import com.cropadvisory.dto.RecommendationQuery;
import com.cropadvisory.dto.TrackRecommendationRequest;
import com.cropadvisory.dto.WeatherSnapshot;
import com.cropadvisory.exception.DataUnavailableException;
import com.cropadvisory.knowledge.CropKnowledgeBase;
import com.cropadvisory.ml.FeatureExtractor;
import com.cropadvisory.ml.PredictiveModelEnsemble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecommendationFusionServiceTest {

    @Mock GovernmentDataClient governmentDataClient;
    @Mock BaseRecommendationClient baseRecommendationClient;
    @Mock OutcomeStoreService outcomeStore;
    @Mock PredictiveModelEnsemble ensemble;

    private final Clock clock = Clock.fixed(Instant.parse("2025-11-15T04:30:00Z"), ZoneOffset.UTC);
    private RecommendationFusionService service;

    @BeforeEach
    void setUp() {
        CropKnowledgeBase knowledgeBase = new CropKnowledgeBase();
        service = new RecommendationFusionService(
            governmentDataClient, baseRecommendationClient, outcomeStore,
            new ForecastAnalyzer(knowledgeBase), ensemble, new FeatureExtractor(),
            new MarketOutlookCalculator(knowledgeBase), new CompositeScorer(), knowledgeBase, clock);
        ReflectionTestUtils.setField(service, "gatewayTimeoutSeconds", 1);
        ReflectionTestUtils.setField(service, "baseProviderTimeoutSeconds", 2);

        lenient().when(ensemble.isTrained()).thenReturn(false);
        lenient().when(ensemble.predictSuccess(any())).thenReturn(PredictiveModelEnsemble.UNTRAINED_SUCCESS_PROBABILITY);
        lenient().when(ensemble.predictYield(any(), anyDouble())).thenAnswer(inv -> inv.getArgument(1));
        lenient().when(ensemble.predictProfit(any(), anyDouble())).thenAnswer(inv -> inv.getArgument(1));
        lenient().when(outcomeStore.getLocationPerformance(anyString(), anyString())).thenReturn(Map.of());
        lenient().when(outcomeStore.trackRecommendation(any())).thenReturn("REC_20251115043000_abc123");
    }

    private void gatewayDown() {
        when(governmentDataClient.getWeatherData(anyString(), any(), any()))
            .thenReturn(Mono.error(new DataUnavailableException("Gateway /weather unreachable")));
        when(governmentDataClient.getMarketPrices(anyString(), any(), any()))
            .thenReturn(Mono.error(new DataUnavailableException("Gateway /market-prices unreachable")));
        when(governmentDataClient.getSoilHealthData(anyString(), any(), any()))
            .thenReturn(Mono.error(new DataUnavailableException("Gateway /soil-health unreachable")));
    }

    private void baseReturns(CropCandidate... candidates) {
        when(baseRecommendationClient.getRecommendations(anyString(), anyString(), anyString(), any(), any()))
            .thenReturn(Mono.just(List.of(candidates)));
    }

    private static CropCandidate candidate(String crop, double suitability) {
        return CropCandidate.builder()
            .crop(crop)
            .suitabilityScore(suitability)
            .yieldPerHectare(40)
            .profitPerHectare(60_000)
            .mspPerQuintal(2_000)
            .durationDays(120)
            .season("rabi")
            .build();
    }

    private static RecommendationQuery delhi(String soilType, String season) {
        return RecommendationQuery.builder()
            .location("Delhi").soilType(soilType).season(season).latitude(28.61).longitude(77.21).build();
    }

    @Test
    void degradedScenario_gatewayDownNoHistory_returnsBaselineDrivenMediumConfidence() {
        gatewayDown();
        baseReturns(candidate("wheat", 75), candidate("mustard", 70), candidate("chickpea", 68));

        EnhancedRecommendationResponse response = service.getEnhancedRecommendations(delhi("loamy", "rabi"));

        assertThat(response.getLocation()).isEqualTo("Delhi");
        assertThat(response.getSeason()).isEqualTo("rabi");
        assertThat(response.getSoilType()).isEqualTo("loamy");
        assertThat(response.getRecommendationId()).isEqualTo("REC_20251115043000_abc123");
        assertThat(response.getDataSources())
            .containsEntry("weather", CurrentConditions.FALLBACK)
            .containsEntry("market", CurrentConditions.FALLBACK)
            .containsEntry("soil", CurrentConditions.FALLBACK)
            .containsEntry("historical", "none");
        assertThat(response.getCurrentConditions().getDataSource()).isEqualTo(CurrentConditions.FALLBACK);
        assertThat(response.getForecastSummary().getStatus()).isEqualTo(ForecastSummary.NO_FORECAST);
        assertThat(response.getTimestamp()).isEqualTo(clock.instant());

        assertThat(response.getRecommendations()).extracting(EnhancedRecommendation::getCrop)
            .containsExactly("wheat", "mustard", "chickpea");
        assertThat(response.getRecommendations()).allSatisfy(r -> {
            assertThat(r.getConfidenceLevel()).isIn(CompositeScorer.MEDIUM, CompositeScorer.LOW);
            assertThat(r.getWeatherForecastAnalysis().getSuitabilityScore()).isEqualTo(10.0);
            assertThat(r.getPredictions().getMethod()).isEqualTo(RecommendationFusionService.METHOD_UNTRAINED);
        });
        // 0.6*75 + 7.5 neutral history + 10 neutral weather + 0.75*15
        assertThat(response.getRecommendations().get(0).getEnhancedScore()).isEqualTo(73.8);
    }

    @Test
    void degradedScenario_defaultsSeasonFromClockAndSoilToLoamy() {
        gatewayDown();
        baseReturns(candidate("wheat", 75));

        EnhancedRecommendationResponse response = service.getEnhancedRecommendations(delhi(null, null));

        assertThat(response.getSeason()).isEqualTo("rabi");
        assertThat(response.getSoilType()).isEqualTo("loamy");
        verify(baseRecommendationClient).getRecommendations(eq("Delhi"), eq("loamy"), eq("rabi"), eq(28.61), eq(77.21));
    }

    @Test
    void baseProviderFailure_raisesDataUnavailableAndTracksNothing() {
        gatewayDown();
        when(baseRecommendationClient.getRecommendations(anyString(), anyString(), anyString(), any(), any()))
            .thenReturn(Mono.error(new DataUnavailableException("Base recommendation provider returned 500")));

        assertThatThrownBy(() -> service.getEnhancedRecommendations(delhi("loamy", "rabi")))
            .isInstanceOf(DataUnavailableException.class);
        verify(outcomeStore, never()).trackRecommendation(any());
    }

    @Test
    void baseProviderEmpty_isTreatedAsUnavailable() {
        gatewayDown();
        when(baseRecommendationClient.getRecommendations(anyString(), anyString(), anyString(), any(), any()))
            .thenReturn(Mono.just(List.of()));

        assertThatThrownBy(() -> service.getEnhancedRecommendations(delhi("loamy", "rabi")))
            .isInstanceOf(DataUnavailableException.class);
    }

    @Test
    void manyCandidates_keepsTopEightSortedDescending() {
        gatewayDown();
        List<CropCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            candidates.add(candidate("crop" + i, 50 + i * 3));
        }
        when(baseRecommendationClient.getRecommendations(anyString(), anyString(), anyString(), any(), any()))
            .thenReturn(Mono.just(candidates));

        List<EnhancedRecommendation> result = service.getEnhancedRecommendations(delhi("loamy", "rabi")).getRecommendations();

        assertThat(result).hasSize(RecommendationFusionService.MAX_RECOMMENDATIONS);
        assertThat(result).extracting(EnhancedRecommendation::getEnhancedScore)
            .isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertThat(result.get(0).getCrop()).isEqualTo("crop11");
    }

    @Test
    void candidateFailure_degradesThatCandidateToBaseline() {
        gatewayDown();
        CropCandidate broken = CropCandidate.builder()
            .crop("maize").suitabilityScore(90).yieldPerHectare(999).profitPerHectare(43_450)
            .mspPerQuintal(1_870).durationDays(100).season("kharif").build();
        baseReturns(candidate("wheat", 75), broken);
        when(ensemble.predictYield(any(), eq(999.0))).thenThrow(new IllegalStateException("numeric failure"));

        List<EnhancedRecommendation> result = service.getEnhancedRecommendations(delhi("loamy", "rabi")).getRecommendations();

        EnhancedRecommendation maize = result.stream().filter(r -> r.getCrop().equals("maize")).findFirst().orElseThrow();
        assertThat(maize.isBaselineOnly()).isTrue();
        assertThat(maize.getEnhancedScore()).isEqualTo(90.0);
        assertThat(maize.getConfidenceLevel()).isEqualTo(CompositeScorer.LOW);
        assertThat(maize.getPredictions()).isNull();
        assertThat(result).hasSize(2);
    }

    @Test
    void untrainedWithEnoughHistory_usesHistoricalStatistics() {
        gatewayDown();
        baseReturns(candidate("wheat", 75));
        PerformanceSnapshot wheat = PerformanceSnapshot.builder()
            .location("delhi").crop("wheat").season("rabi")
            .totalAttempts(6).successfulAttempts(3).successRate(0.5)
            .avgYield(30.0).avgProfit(40_000.0).dataQuality("low").build();
        when(outcomeStore.getLocationPerformance("Delhi", "rabi")).thenReturn(Map.of("wheat", wheat));

        EnhancedRecommendation rec = service.getEnhancedRecommendations(delhi("loamy", "rabi")).getRecommendations().get(0);

        assertThat(rec.getPredictions().getMethod()).isEqualTo(RecommendationFusionService.METHOD_HISTORICAL);
        assertThat(rec.getPredictions().getSuccessProbability()).isEqualTo(0.5);
        assertThat(rec.getPredictions().getYield().getExpected()).isEqualTo(30.0);
        assertThat(rec.getPredictions().getYield().getOptimistic()).isEqualTo(36.0);
        assertThat(rec.getPredictions().getProfit().getPessimistic()).isEqualTo(28_000.0);
        assertThat(rec.getHistoricalPerformance()).isSameAs(wheat);
        // 45 + 0.5*15 + 10 + 0.5*15
        assertThat(rec.getEnhancedScore()).isEqualTo(70.0);
        verify(ensemble, never()).predictYield(any(), anyDouble());
    }

    @Test
    void trainedModel_drivesPredictionsAndConfidence() {
        gatewayDown();
        baseReturns(candidate("wheat", 70));
        when(ensemble.isTrained()).thenReturn(true);
        when(ensemble.predictSuccess(any())).thenReturn(0.9);

        EnhancedRecommendationResponse response = service.getEnhancedRecommendations(delhi("loamy", "rabi"));
        EnhancedRecommendation rec = response.getRecommendations().get(0);

        assertThat(rec.getPredictions().getMethod()).isEqualTo(RecommendationFusionService.METHOD_MODEL);
        assertThat(response.getDataSources()).containsEntry("predictions", RecommendationFusionService.METHOD_MODEL);
        // 0.2 + 0 + 0.3 + 0.1
        assertThat(rec.getConfidenceLevel()).isEqualTo(CompositeScorer.MEDIUM);
    }

    @Test
    void liveGateway_feedsWeatherMarketAndSoilIntoResponse() {
        List<DailyForecast> forecast = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            forecast.add(DailyForecast.builder().temperature(20.0).condition(i < 3 ? "Light rain" : "Sunny").build());
        }
        when(governmentDataClient.getWeatherData(anyString(), any(), any()))
            .thenReturn(Mono.just(WeatherSnapshot.builder().temperature(21.0).humidity(55.0).forecast(forecast).build()));
        when(governmentDataClient.getMarketPrices(anyString(), any(), any()))
            .thenReturn(Mono.just(Map.<String, Object>of("wheat", 2_300)));
        when(governmentDataClient.getSoilHealthData(anyString(), any(), any()))
            .thenReturn(Mono.just(Map.<String, Object>of("type", "Black", "ph", 7.2)));
        baseReturns(candidate("wheat", 75));

        EnhancedRecommendationResponse response = service.getEnhancedRecommendations(delhi(null, "rabi"));

        assertThat(response.getSoilType()).isEqualTo("black");
        assertThat(response.getDataSources())
            .containsEntry("weather", CurrentConditions.REAL_TIME)
            .containsEntry("market", CurrentConditions.REAL_TIME)
            .containsEntry("soil", CurrentConditions.REAL_TIME);
        assertThat(response.getForecastSummary().getForecastDays()).isEqualTo(7);
        EnhancedRecommendation wheat = response.getRecommendations().get(0);
        assertThat(wheat.getWeatherForecastAnalysis().getSuitabilityScore()).isEqualTo(20.0);
        assertThat(wheat.getPredictions().getMarketPrice().getDataSource()).isEqualTo(MarketOutlookCalculator.REAL_TIME);
        // 0.2 + 0 + 0.2 + 0.2 with a full-week forecast
        assertThat(wheat.getConfidenceLevel()).isEqualTo(CompositeScorer.MEDIUM);
        assertThat(wheat.getWeatherForecastAnalysis().isHighConfidence()).isTrue();
    }

    @Test
    void stalledGatewayFeed_timesOutIntoFallback() {
        when(governmentDataClient.getWeatherData(anyString(), any(), any())).thenReturn(Mono.never());
        when(governmentDataClient.getMarketPrices(anyString(), any(), any())).thenReturn(Mono.just(Map.<String, Object>of()));
        when(governmentDataClient.getSoilHealthData(anyString(), any(), any())).thenReturn(Mono.just(Map.<String, Object>of()));
        baseReturns(candidate("wheat", 75));

        EnhancedRecommendationResponse response = service.getEnhancedRecommendations(delhi("loamy", "rabi"));

        assertThat(response.getDataSources()).containsEntry("weather", CurrentConditions.FALLBACK);
        assertThat(response.getRecommendations()).hasSize(1);
    }

    @Test
    void trackedRecommendationListsReturnedCrops() {
        gatewayDown();
        baseReturns(candidate("wheat", 75), candidate("mustard", 70));

        service.getEnhancedRecommendations(delhi("loamy", "rabi"));

        ArgumentCaptor<TrackRecommendationRequest> captor = ArgumentCaptor.forClass(TrackRecommendationRequest.class);
        verify(outcomeStore).trackRecommendation(captor.capture());
        assertThat(captor.getValue().getCrops()).containsExactly("wheat", "mustard");
        assertThat(captor.getValue().getSeason()).isEqualTo("rabi");
        assertThat(captor.getValue().getSoilType()).isEqualTo("loamy");
    }
}
