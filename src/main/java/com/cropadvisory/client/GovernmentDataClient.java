package com.cropadvisory.client;

import com.cropadvisory.dto.DailyForecast;
import com.cropadvisory.dto.WeatherSnapshot;
import com.cropadvisory.exception.DataUnavailableException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
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
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Client for the government data gateway (weather, market prices, soil health).
 * Every call resolves to the {@code data} payload of a {@code {status, data}}
 * envelope, or errors with {@link DataUnavailableException} on transport failure,
 * timeout, or any status other than {@code success}.
 */
@Slf4j
@Component
public class GovernmentDataClient {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @Value("${advisory.gateway.base-url}")
    private String baseUrl;

    @Value("${advisory.gateway.timeout-seconds:5}")
    private int timeoutSeconds = 5;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 3_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
        log.info("GovernmentDataClient initialised → {}", baseUrl);
    }

    public Mono<WeatherSnapshot> getWeatherData(String location, Double latitude, Double longitude) {
        return fetch("/weather", location, latitude, longitude).map(GovernmentDataClient::toWeather);
    }

    public Mono<Map<String, Object>> getMarketPrices(String location, Double latitude, Double longitude) {
        return fetch("/market-prices", location, latitude, longitude).map(this::toMap);
    }

    public Mono<Map<String, Object>> getSoilHealthData(String location, Double latitude, Double longitude) {
        return fetch("/soil-health", location, latitude, longitude).map(this::toMap);
    }

    private Mono<JsonNode> fetch(String path, String location, Double latitude, Double longitude) {
        return webClient.get()
            .uri(b -> query(b.path(path), location, latitude, longitude))
            .retrieve()
            .onStatus(HttpStatusCode::isError, resp -> Mono.just(new DataUnavailableException(
                "Gateway " + path + " returned " + resp.statusCode().value())))
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .flatMap(json -> unwrap(path, json))
            .onErrorMap(WebClientRequestException.class,
                ex -> new DataUnavailableException("Gateway " + path + " unreachable", ex))
            .doOnError(ex -> log.warn("Gateway call failed | path={} | location={} | reason={}",
                path, location, ex.getMessage()));
    }

    private static URI query(UriBuilder builder, String location, Double latitude, Double longitude) {
        builder.queryParam("location", location);
        if (latitude != null) {
            builder.queryParam("lat", latitude);
        }
        if (longitude != null) {
            builder.queryParam("lon", longitude);
        }
        return builder.build();
    }

    private static Mono<JsonNode> unwrap(String path, JsonNode json) {
        if (json == null || !"success".equals(json.path("status").asText())) {
            return Mono.error(new DataUnavailableException(
                "Gateway " + path + " status: " + (json == null ? "empty" : json.path("status").asText("missing"))));
        }
        JsonNode data = json.get("data");
        return Mono.just(data != null && !data.isNull() ? data : JsonNodeFactory.instance.objectNode());
    }

    private Map<String, Object> toMap(JsonNode data) {
        if (data == null || !data.isObject()) {
            return Map.of();
        }
        return mapper.convertValue(data, MAP_TYPE);
    }

    static WeatherSnapshot toWeather(JsonNode data) {
        List<DailyForecast> forecast = new ArrayList<>();
        JsonNode days = data.has("forecast_7day") ? data.get("forecast_7day") : data.path("forecast");
        if (days.isArray()) {
            for (JsonNode day : days) {
                forecast.add(DailyForecast.builder()
                    .date(readDate(day.get("date")))
                    .temperature(readNumber(day.get("temperature")))
                    .condition(readText(day.get("condition")))
                    .rainfallMm(readNumber(day.get("rainfall")))
                    .build());
            }
        }
        return WeatherSnapshot.builder()
            .temperature(readNumber(data.get("temperature")))
            .humidity(readNumber(data.get("humidity")))
            .condition(readText(data.get("condition")))
            .rainfallMm(readNumber(data.get("rainfall")))
            .forecast(List.copyOf(forecast))
            .build();
    }

    /**
     * Reads a number that may arrive either as JSON numeric or as a unit-suffixed
     * string such as {@code "25°C"}, {@code "65%"} or {@code "2.5 mm"}.
     */
    static Double readNumber(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject() && node.has("current")) {
            return readNumber(node.get("current"));
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else {
            Matcher m = NUMBER.matcher(node.asText(""));
            if (!m.find()) {
                return null;
            }
            value = Double.parseDouble(m.group());
        }
        // values that overflow a double are treated as missing
        return Double.isFinite(value) ? value : null;
    }

    private static String readText(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static LocalDate readDate(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return LocalDate.parse(node.asText());
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
