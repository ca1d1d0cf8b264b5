package com.cropadvisory.controller;

import com.cropadvisory.dto.FeedbackRequest;
import com.cropadvisory.dto.RecommendationQuery;
import com.cropadvisory.dto.TrackRecommendationRequest;
import com.cropadvisory.ml.FeatureVector;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class AdvisoryControllerIntegrationTest {

    private static WireMockServer wireMock;

    @Autowired TestRestTemplate restTemplate;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().port(9090));
        wireMock.start();
        WireMock.configureFor("localhost", 9090);
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    private static String uniqueLocation() {
        return "Nagpur-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private RecommendationQuery query(String location) {
        return RecommendationQuery.builder()
            .location(location).soilType("loamy").season("rabi").latitude(28.61).longitude(77.21).build();
    }

    private void stubGateway() {
        stubFor(get(urlPathEqualTo("/gov/weather")).willReturn(okJson("""
            {"status":"success","data":{"temperature":"19°C","humidity":"58%","condition":"Clear",
              "forecast_7day":[
                {"date":"2025-11-16","temperature":"20°C","condition":"Sunny"},
                {"date":"2025-11-17","temperature":"21°C","condition":"Light rain"},
                {"date":"2025-11-18","temperature":"19°C","condition":"Light rain"},
                {"date":"2025-11-19","temperature":"20°C","condition":"Sunny"},
                {"date":"2025-11-20","temperature":"18°C","condition":"Cloudy"}
              ]}}
            """)));
        stubFor(get(urlPathEqualTo("/gov/market-prices")).willReturn(okJson(
            "{\"status\":\"success\",\"data\":{\"wheat\":2300,\"mustard\":5600}}")));
        stubFor(get(urlPathEqualTo("/gov/soil-health")).willReturn(okJson(
            "{\"status\":\"success\",\"data\":{\"type\":\"loamy\",\"ph\":7.1}}")));
    }

    private void stubBaseProvider() {
        stubFor(get(urlPathEqualTo("/base/recommendations")).willReturn(okJson("""
            {"recommendations":[
              {"crop":"wheat","suitability_score":78,"yield_per_hectare":45,"profit_per_hectare":70625,
               "msp_per_quintal":2125,"duration_days":120,"season":"rabi"},
              {"crop":"mustard","suitability_score":72,"yield_per_hectare":15,"profit_per_hectare":45000,
               "msp_per_quintal":5650,"duration_days":110,"season":"rabi"},
              {"crop":"chickpea","suitability_score":66,"season":"rabi"}
            ]}
            """)));
    }

    // ---------------------------------------------------------------
    // POST /recommendations
    // ---------------------------------------------------------------

    @Test
    @SuppressWarnings("unchecked")
    void recommend_returnsRankedEnhancedRecommendations() {
        stubGateway();
        stubBaseProvider();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/recommendations", query("Delhi"), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> body = resp.getBody();
        assertThat((String) body.get("recommendationId")).startsWith("REC_");
        assertThat(body.get("season")).isEqualTo("rabi");
        List<Map<String, Object>> recs = (List<Map<String, Object>>) body.get("recommendations");
        assertThat(recs).hasSize(3);
        assertThat(recs.get(0)).containsKeys("enhancedScore", "confidenceLevel", "predictions", "weatherForecastAnalysis");
        double first = ((Number) recs.get(0).get("enhancedScore")).doubleValue();
        double last = ((Number) recs.get(2).get("enhancedScore")).doubleValue();
        assertThat(first).isGreaterThanOrEqualTo(last);
        Map<String, Object> sources = (Map<String, Object>) body.get("dataSources");
        assertThat(sources.get("weather")).isEqualTo("real-time");
        assertThat(sources.get("market")).isEqualTo("real-time");
        assertThat(((Map<String, Object>) body.get("forecastSummary")).get("forecastDays")).isEqualTo(5);
    }

    @Test
    @SuppressWarnings("unchecked")
    void recommend_gatewayDown_fallsBackAndStillRecommends() {
        stubBaseProvider();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/recommendations", query("Delhi"), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> sources = (Map<String, Object>) resp.getBody().get("dataSources");
        assertThat(sources.get("weather")).isEqualTo("fallback");
        assertThat(sources.get("market")).isEqualTo("fallback");
        List<Map<String, Object>> recs = (List<Map<String, Object>>) resp.getBody().get("recommendations");
        assertThat(recs).isNotEmpty().allSatisfy(r ->
            assertThat(r.get("confidenceLevel")).isIn("Medium", "Low"));
    }

    @Test
    void recommend_baseProviderDown_returns503() {
        stubGateway();
        stubFor(get(urlPathEqualTo("/base/recommendations")).willReturn(aResponse().withStatus(500).withBody("error")));

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/recommendations", query("Delhi"), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("DATA_UNAVAILABLE");
    }

    @Test
    void recommend_missingLocation_returns422() {
        RecommendationQuery bad = RecommendationQuery.builder().soilType("loamy").latitude(120.0).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/recommendations", bad, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsKey("violations");
        assertThat(resp.getBody().get("errorCode")).isEqualTo("VALIDATION_FAILED");
    }

    @Test
    void recommend_echoesRequestId() {
        stubGateway();
        stubBaseProvider();
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "my-trace-id");

        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/recommendations", HttpMethod.POST,
            new HttpEntity<>(query("Delhi"), headers), Map.class);

        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("my-trace-id");
    }

    // ---------------------------------------------------------------
    // tracking, feedback and performance
    // ---------------------------------------------------------------

    @Test
    void track_returnsCreatedWithId() {
        TrackRecommendationRequest request = TrackRecommendationRequest.builder()
            .location("Delhi").season("rabi").soilType("loamy").crops(List.of("wheat")).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/recommendations/track", request, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat((String) resp.getBody().get("recommendationId")).startsWith("REC_");
    }

    @Test
    void feedback_thenPerformanceReflectsOutcome() {
        String location = uniqueLocation();
        FeedbackRequest feedback = FeedbackRequest.builder()
            .location(location).season("rabi").cropChosen("wheat")
            .yieldAchieved(42.0).profitRealized(61_000).satisfactionRating(5).success(true).build();

        ResponseEntity<Map> accepted = restTemplate.postForEntity("/api/v1/feedback", feedback, Map.class);
        ResponseEntity<Map> perf = restTemplate.getForEntity(
            "/api/v1/performance?location={l}&crop=wheat&season=rabi", Map.class, location);
        ResponseEntity<Map> rates = restTemplate.getForEntity(
            "/api/v1/performance/success-rates?location={l}", Map.class, location);

        assertThat(accepted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(accepted.getBody().get("accepted")).isEqualTo(true);
        assertThat(perf.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((Number) perf.getBody().get("totalAttempts")).intValue()).isEqualTo(1);
        assertThat(((Number) perf.getBody().get("avgYield")).doubleValue()).isEqualTo(42.0);
        assertThat(rates.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((Number) rates.getBody().get("wheat")).doubleValue()).isEqualTo(1.0);
    }

    @Test
    void feedback_invalidRating_returns422() {
        FeedbackRequest bad = FeedbackRequest.builder().cropChosen("wheat").satisfactionRating(9).build();

        ResponseEntity<Map> resp = restTemplate.postForEntity("/api/v1/feedback", bad, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void performance_unknownKey_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity(
            "/api/v1/performance?location={l}&crop=wheat&season=rabi", Map.class, uniqueLocation());

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody().get("errorCode")).isEqualTo("PERFORMANCE_NOT_FOUND");
    }

    @Test
    void performance_missingParameter_returns400() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/performance?location=Delhi&crop=wheat", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    // ---------------------------------------------------------------
    // models and jobs
    // ---------------------------------------------------------------

    @Test
    void activeModel_reportsFeatureCount() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/models/active", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("featureCount")).isEqualTo(FeatureVector.SIZE);
    }

    @Test
    @SuppressWarnings("unchecked")
    void retrain_acceptsJobAndCompletes() throws InterruptedException {
        ResponseEntity<Map> submitted = restTemplate.postForEntity("/api/v1/models/retrain", null, Map.class);

        assertThat(submitted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(submitted.getHeaders().getLocation()).isNotNull();
        assertThat(submitted.getBody().get("jobType")).isEqualTo("MODEL_RETRAIN");

        String location = submitted.getHeaders().getLocation().toString();
        Map<String, Object> job = Map.of();
        for (int i = 0; i < 50; i++) {
            job = restTemplate.getForEntity(location, Map.class).getBody();
            if ("COMPLETED".equals(job.get("status")) || "FAILED".equals(job.get("status"))) {
                break;
            }
            Thread.sleep(100);
        }
        if (!"COMPLETED".equals(job.get("status"))) {
            fail("Retrain job did not complete: " + job);
        }
        Map<String, Object> report = (Map<String, Object>) job.get("report");
        assertThat(report).containsKeys("trained", "sampleCount", "minimumSamples", "message");
    }

    @Test
    void jobStatus_unknownId_returns404() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/jobs/" + UUID.randomUUID(), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void jobStatus_malformedId_returns400() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/jobs/not-a-uuid", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }
}
