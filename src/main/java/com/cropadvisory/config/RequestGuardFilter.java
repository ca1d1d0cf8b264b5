package com.cropadvisory.config;

import com.cropadvisory.dto.ApiError;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.util.Arrays;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Front door for {@code /api/**}: assigns or propagates {@code X-Request-ID},
 * and optionally enforces an API key and a per-client requests-per-minute limit.
 */
@Slf4j
@Component
public class RequestGuardFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_ATTRIBUTE = RequestGuardFilter.class.getName() + ".requestId";
    private static final int MAX_TRACKED_CLIENTS = 10_000;

    @Value("${advisory.security.api-key.enabled:false}")
    private boolean apiKeyEnabled;

    @Value("${advisory.security.api-key.header:X-API-Key}")
    private String apiKeyHeader = "X-API-Key";

    @Value("${advisory.security.api-key.values:}")
    private String apiKeyValues = "";

    @Value("${advisory.security.rate-limit.enabled:false}")
    private boolean rateLimitEnabled;

    @Value("${advisory.security.rate-limit.requests-per-minute:60}")
    private int requestsPerMinute = 60;

    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final ConcurrentHashMap<String, MinuteWindow> windows = new ConcurrentHashMap<>();
    private Set<String> allowedKeys = Set.of();

    public RequestGuardFilter(Clock clock) {
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        allowedKeys = Arrays.stream(apiKeyValues.split(","))
            .map(String::trim)
            .filter(v -> !v.isBlank())
            .collect(Collectors.toUnmodifiableSet());
        if (apiKeyEnabled && allowedKeys.isEmpty()) {
            log.warn("API key check enabled with no keys configured; every /api request will be rejected");
        }
    }

    /** Request id assigned by this filter, falling back to the inbound header. */
    public static String requestId(HttpServletRequest request) {
        Object assigned = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        return assigned != null ? assigned.toString() : request.getHeader(REQUEST_ID_HEADER);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String inbound = request.getHeader(REQUEST_ID_HEADER);
        String requestId = inbound != null && !inbound.isBlank() ? inbound : UUID.randomUUID().toString();
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        String apiKey = request.getHeader(apiKeyHeader);
        if (apiKeyEnabled && (apiKey == null || !allowedKeys.contains(apiKey))) {
            reject(response, HttpServletResponse.SC_UNAUTHORIZED, "UNAUTHORIZED",
                   "Missing or invalid API key", request.getRequestURI(), requestId);
            return;
        }

        if (rateLimitEnabled && !tryAcquire(clientKey(request, apiKey))) {
            reject(response, 429, "RATE_LIMITED",
                   "Rate limit of " + requestsPerMinute + " requests per minute exceeded",
                   request.getRequestURI(), requestId);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private static String clientKey(HttpServletRequest request, String apiKey) {
        if (apiKey != null && !apiKey.isBlank()) {
            return "key:" + apiKey;
        }
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return "ip:" + forwardedFor.split(",")[0].trim();
        }
        return "ip:" + request.getRemoteAddr();
    }

    boolean tryAcquire(String clientKey) {
        long minute = clock.millis() / 60_000L;
        MinuteWindow window = windows.compute(clientKey, (key, existing) ->
            existing == null || existing.minute() != minute ? new MinuteWindow(minute, new AtomicInteger()) : existing);
        if (windows.size() > MAX_TRACKED_CLIENTS) {
            windows.entrySet().removeIf(e -> e.getValue().minute() < minute - 1);
        }
        return window.count().incrementAndGet() <= requestsPerMinute;
    }

    private void reject(HttpServletResponse response, int status, String errorCode, String message,
                        String path, String requestId) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        ApiError body = ApiError.builder()
            .status(status)
            .errorCode(errorCode)
            .message(message)
            .path(path)
            .requestId(requestId)
            .timestamp(clock.instant())
            .build();
        mapper.writeValue(response.getWriter(), body);
        log.warn("Request rejected | status={} | path={} | requestId={} | reason={}", status, path, requestId, message);
    }

    private record MinuteWindow(long minute, AtomicInteger count) {}
}
