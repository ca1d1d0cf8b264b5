package com.cropadvisory.client;

import com.cropadvisory.dto.CropCandidate;
import com.cropadvisory.exception.DataUnavailableException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Client for the baseline suitability provider. Its candidate list is the only
 * input the advisory cannot substitute, so every failure surfaces as
 * {@link DataUnavailableException}.
 */
@Slf4j
@Component
public class BaseRecommendationClient {

    private static final Set<String> KNOWN_FIELDS = Set.of(
        "crop", "name", "suitability_score", "suitability", "yield_per_hectare", "profit_per_hectare",
        "msp_per_quintal", "duration_days", "season", "water_requirement");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static final double DEFAULT_SUITABILITY = 70.0;

    @Value("${advisory.base-provider.base-url}")
    private String baseUrl;

    @Value("${advisory.base-provider.timeout-seconds:10}")
    private int timeoutSeconds = 10;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
        log.info("BaseRecommendationClient initialised → {}", baseUrl);
    }

    public Mono<List<CropCandidate>> getRecommendations(String location, String soilType, String season,
                                                        Double latitude, Double longitude) {
        return webClient.get()
            .uri(b -> {
                b.path("/recommendations")
                    .queryParam("location", location)
                    .queryParam("soil_type", soilType)
                    .queryParam("season", season);
                if (latitude != null) {
                    b.queryParam("lat", latitude);
                }
                if (longitude != null) {
                    b.queryParam("lon", longitude);
                }
                return b.build();
            })
            .retrieve()
            .onStatus(HttpStatusCode::isError, resp -> Mono.just(new DataUnavailableException(
                "Base recommendation provider returned " + resp.statusCode().value())))
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .map(this::toCandidates)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new DataUnavailableException(
                    "Base recommendation provider unreachable", sig.failure())))
            .onErrorMap(ex -> !(ex instanceof DataUnavailableException),
                ex -> new DataUnavailableException("Base recommendations unavailable: " + ex.getMessage(), ex));
    }

    List<CropCandidate> toCandidates(JsonNode json) {
        JsonNode list = json == null ? null : json.get("recommendations");
        if (list == null || !list.isArray()) {
            throw new DataUnavailableException("Base provider response missing 'recommendations'");
        }
        List<CropCandidate> candidates = new ArrayList<>();
        for (JsonNode node : list) {
            String crop = text(node, "crop", text(node, "name", null));
            if (crop == null || crop.isBlank()) {
                log.warn("Skipping base candidate without a crop name | entry={}", node);
                continue;
            }
            candidates.add(CropCandidate.builder()
                .crop(crop.trim())
                .suitabilityScore(number(node, "suitability_score", number(node, "suitability", DEFAULT_SUITABILITY)))
                .yieldPerHectare(number(node, "yield_per_hectare", 0.0))
                .profitPerHectare(number(node, "profit_per_hectare", 0.0))
                .mspPerQuintal(number(node, "msp_per_quintal", 0.0))
                .durationDays((int) number(node, "duration_days", 0.0))
                .season(text(node, "season", null))
                .waterRequirement(text(node, "water_requirement", null))
                .attributes(extras(node))
                .build());
        }
        if (candidates.isEmpty()) {
            throw new DataUnavailableException("Base provider returned no candidates");
        }
        return candidates;
    }

    private Map<String, Object> extras(JsonNode node) {
        Map<String, Object> all = mapper.convertValue(node, MAP_TYPE);
        Map<String, Object> extras = new LinkedHashMap<>();
        all.forEach((k, v) -> {
            if (!KNOWN_FIELDS.contains(k) && v != null) {
                extras.put(k, v);
            }
        });
        return extras;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? fallback : v.asText();
    }

    private static double number(JsonNode node, String field, double fallback) {
        Double parsed = GovernmentDataClient.readNumber(node.get(field));
        return parsed != null && Double.isFinite(parsed) ? parsed : fallback;
    }
}
