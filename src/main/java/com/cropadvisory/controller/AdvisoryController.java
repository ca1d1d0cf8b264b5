package com.cropadvisory.controller;

import com.cropadvisory.config.RequestGuardFilter;
import com.cropadvisory.dto.AsyncJobResponse;
import com.cropadvisory.dto.EnhancedRecommendationResponse;
import com.cropadvisory.dto.FeedbackRequest;
import com.cropadvisory.dto.ModelStatusResponse;
import com.cropadvisory.dto.PerformanceSnapshot;
import com.cropadvisory.dto.RecommendationQuery;
import com.cropadvisory.dto.TrackRecommendationRequest;
import com.cropadvisory.exception.PerformanceNotFoundException;
import com.cropadvisory.ml.PredictiveModelEnsemble;
import com.cropadvisory.service.AsyncJobService;
import com.cropadvisory.service.ModelRetrainingService;
import com.cropadvisory.service.OutcomeStoreService;
import com.cropadvisory.service.RecommendationFusionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AdvisoryController {

    private final RecommendationFusionService fusionService;
    private final OutcomeStoreService outcomeStore;
    private final PredictiveModelEnsemble ensemble;
    private final ModelRetrainingService retrainingService;
    private final AsyncJobService asyncJobService;

    @PostMapping("/recommendations")
    public ResponseEntity<EnhancedRecommendationResponse> recommend(
            @Valid @RequestBody RecommendationQuery query, HttpServletRequest httpRequest) {
        log.info("POST /recommendations | location={} | season={} | requestId={}",
                 query.getLocation(), query.getSeason(), RequestGuardFilter.requestId(httpRequest));
        return ResponseEntity.ok(fusionService.getEnhancedRecommendations(query));
    }

    @PostMapping("/recommendations/track")
    public ResponseEntity<Map<String, String>> track(@Valid @RequestBody TrackRecommendationRequest request) {
        String id = outcomeStore.trackRecommendation(request);
        HttpStatus status = id.isEmpty() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(Map.of("recommendationId", id));
    }

    @PostMapping("/feedback")
    public ResponseEntity<Map<String, Boolean>> feedback(@Valid @RequestBody FeedbackRequest request) {
        log.info("POST /feedback | crop={} | recommendationId={} | success={}",
                 request.getCropChosen(), request.getRecommendationId(), request.isSuccess());
        boolean accepted = outcomeStore.collectFeedback(request);
        HttpStatus status = accepted ? HttpStatus.ACCEPTED : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(Map.of("accepted", accepted));
    }

    @GetMapping("/performance")
    public ResponseEntity<PerformanceSnapshot> performance(
            @RequestParam @NotBlank String location,
            @RequestParam @NotBlank String crop,
            @RequestParam @NotBlank String season) {
        return outcomeStore.getCropPerformance(location, crop, season)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new PerformanceNotFoundException(location, crop, season));
    }

    @GetMapping("/performance/success-rates")
    public ResponseEntity<Map<String, Double>> successRates(@RequestParam @NotBlank String location) {
        return ResponseEntity.ok(outcomeStore.getSuccessRateByLocation(location));
    }

    @GetMapping("/models/active")
    public ResponseEntity<ModelStatusResponse> activeModel() {
        return ResponseEntity.ok(ensemble.status());
    }

    @PostMapping("/models/retrain")
    public ResponseEntity<AsyncJobResponse> retrain(HttpServletRequest httpRequest) {
        String requestId = RequestGuardFilter.requestId(httpRequest);
        UUID jobId = asyncJobService.submit("MODEL_RETRAIN", requestId, retrainingService::retrain);
        return ResponseEntity.accepted()
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }
}
