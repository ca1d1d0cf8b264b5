package com.cropadvisory.service;

import com.cropadvisory.dto.FeedbackRequest;
import com.cropadvisory.dto.PerformanceSnapshot;
import com.cropadvisory.dto.TrackRecommendationRequest;
import com.cropadvisory.dto.WeatherSnapshot;
import com.cropadvisory.entity.FeedbackRecord;
import com.cropadvisory.entity.PerformanceAggregate;
import com.cropadvisory.entity.RecommendationRecord;
import com.cropadvisory.knowledge.CropKnowledgeBase;
import com.cropadvisory.knowledge.CropProfile;
import com.cropadvisory.knowledge.Season;
import com.cropadvisory.ml.CropAttributes;
import com.cropadvisory.ml.FeatureExtractor;
import com.cropadvisory.ml.GeoPoint;
import com.cropadvisory.ml.TrainingSample;
import com.cropadvisory.repository.FeedbackRepository;
import com.cropadvisory.repository.PerformanceAggregateRepository;
import com.cropadvisory.repository.RecommendationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Append-only store of recommendation and feedback events plus the per
 * (location, crop, season) performance aggregates derived from them.
 *
 * <p>Persistence failures are logged and degrade to "untracked" / "no data";
 * nothing here throws a data-access exception at the caller.
 */
@Slf4j
@Service
public class OutcomeStoreService {

    static final String UNTRACKED = "";
    static final int HIGH_QUALITY_ATTEMPTS = 10;

    private static final DateTimeFormatter ID_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final RecommendationRepository recommendationRepository;
    private final FeedbackRepository feedbackRepository;
    private final PerformanceAggregateRepository aggregateRepository;
    private final FeatureExtractor featureExtractor;
    private final CropKnowledgeBase knowledgeBase;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    static final int LOCK_STRIPES = 64;

    // writes to one aggregate key always map to the same stripe
    private final ReentrantLock[] keyLocks = new ReentrantLock[LOCK_STRIPES];

    public OutcomeStoreService(RecommendationRepository recommendationRepository,
                               FeedbackRepository feedbackRepository,
                               PerformanceAggregateRepository aggregateRepository,
                               FeatureExtractor featureExtractor,
                               CropKnowledgeBase knowledgeBase,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
        this.recommendationRepository = recommendationRepository;
        this.feedbackRepository = feedbackRepository;
        this.aggregateRepository = aggregateRepository;
        this.featureExtractor = featureExtractor;
        this.knowledgeBase = knowledgeBase;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        for (int i = 0; i < keyLocks.length; i++) {
            keyLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Records a recommendation. Returns the new id, or an empty string when the
     * record could not be stored.
     */
    public String trackRecommendation(TrackRecommendationRequest request) {
        Instant now = Instant.now(clock);
        String id = newId("REC", now);
        try {
            recommendationRepository.save(RecommendationRecord.builder()
                .id(id)
                .location(request.getLocation())
                .latitude(request.getLatitude())
                .longitude(request.getLongitude())
                .season(Season.canonicalKey(request.getSeason()))
                .soilType(request.getSoilType())
                .weather(request.getWeather() != null ? request.getWeather() : WeatherSnapshot.empty())
                .crops(new ArrayList<>(request.getCrops() != null ? request.getCrops() : List.of()))
                .createdAt(now)
                .build());
            log.info("Recommendation tracked | id={} | location={} | crops={}",
                id, request.getLocation(), request.getCrops() != null ? request.getCrops().size() : 0);
            return id;
        } catch (DataAccessException | TransactionException ex) {
            log.error("Recommendation could not be tracked | location={} | reason={}",
                request.getLocation(), ex.getMessage());
            return UNTRACKED;
        }
    }

    /**
     * Appends the feedback event and applies it to its performance aggregate in one
     * transaction. Writes to the same aggregate are serialised.
     */
    public boolean collectFeedback(FeedbackRequest request) {
        Instant now = Instant.now(clock);
        try {
            Optional<RecommendationRecord> source = findRecommendation(request.getRecommendationId());
            String location = firstNonBlank(request.getLocation(), source.map(RecommendationRecord::getLocation).orElse(null));
            String season = firstNonBlank(request.getSeason(), source.map(RecommendationRecord::getSeason).orElse(null));
            String key = PerformanceAggregate.keyOf(location, request.getCropChosen(), season);

            FeedbackRecord feedback = FeedbackRecord.builder()
                .id(newId("FB", now))
                .recommendationId(blankToNull(request.getRecommendationId()))
                .farmerId(request.getFarmerId())
                .location(PerformanceAggregate.normalize(location))
                .season(PerformanceAggregate.normalizeSeason(season))
                .cropChosen(PerformanceAggregate.normalize(request.getCropChosen()))
                .yieldAchieved(request.getYieldAchieved())
                .profitRealized(request.getProfitRealized())
                .satisfactionRating(request.getSatisfactionRating())
                .success(request.isSuccess())
                .comments(request.getComments())
                .createdAt(now)
                .build();

            ReentrantLock lock = lockFor(key);
            lock.lock();
            try {
                transactionTemplate.executeWithoutResult(status -> {
                    feedbackRepository.save(feedback);
                    PerformanceAggregate aggregate = aggregateRepository.findForUpdate(key)
                        .orElseGet(() -> PerformanceAggregate.open(location, request.getCropChosen(), season));
                    aggregate.record(feedback.isSuccess(), feedback.getYieldAchieved(), feedback.getProfitRealized(), now);
                    aggregateRepository.save(aggregate);
                });
            } finally {
                lock.unlock();
            }
            log.info("Feedback collected | id={} | key={} | success={} | recommendationId={}",
                feedback.getId(), key, feedback.isSuccess(), feedback.getRecommendationId());
            return true;
        } catch (DataAccessException | TransactionException ex) {
            log.error("Feedback could not be stored | crop={} | recommendationId={} | reason={}",
                request.getCropChosen(), request.getRecommendationId(), ex.getMessage());
            return false;
        }
    }

    public Optional<PerformanceSnapshot> getCropPerformance(String location, String crop, String season) {
        try {
            return aggregateRepository.findById(PerformanceAggregate.keyOf(location, crop, season))
                .map(OutcomeStoreService::toSnapshot);
        } catch (DataAccessException ex) {
            log.error("Crop performance unavailable | location={} | crop={} | season={} | reason={}",
                location, crop, season, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Success rate per crop at a location, pooled across seasons.
     */
    public Map<String, Double> getSuccessRateByLocation(String location) {
        try {
            return aggregateRepository.findByLocation(PerformanceAggregate.normalize(location)).stream()
                .collect(Collectors.groupingBy(PerformanceAggregate::getCrop, LinkedHashMap::new, Collectors.toList()))
                .entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> pooledRate(e.getValue()),
                    (a, b) -> a, LinkedHashMap::new));
        } catch (DataAccessException ex) {
            log.error("Success rates unavailable | location={} | reason={}", location, ex.getMessage());
            return Map.of();
        }
    }

    /**
     * All aggregates for one location and season, keyed by crop.
     */
    public Map<String, PerformanceSnapshot> getLocationPerformance(String location, String season) {
        try {
            return aggregateRepository.findByLocationAndSeason(
                    PerformanceAggregate.normalize(location), PerformanceAggregate.normalizeSeason(season)).stream()
                .collect(Collectors.toMap(PerformanceAggregate::getCrop, OutcomeStoreService::toSnapshot,
                    (a, b) -> a, LinkedHashMap::new));
        } catch (DataAccessException ex) {
            log.error("Location performance unavailable | location={} | season={} | reason={}",
                location, season, ex.getMessage());
            return Map.of();
        }
    }

    /**
     * Joins feedback to the recommendation it refers to and turns each pair into a
     * training sample. Feedback whose recommendation cannot be found is skipped.
     * Returns an empty list when fewer than {@code minSamples} pairs exist.
     */
    public List<TrainingSample> getTrainingData(int minSamples) {
        try {
            List<FeedbackRecord> feedback = feedbackRepository.findAllByOrderByCreatedAtAsc();
            Set<String> referenced = feedback.stream()
                .map(FeedbackRecord::getRecommendationId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
            Map<String, RecommendationRecord> byId = recommendationRepository.findAllById(referenced).stream()
                .collect(Collectors.toMap(RecommendationRecord::getId, Function.identity()));

            List<TrainingSample> samples = new ArrayList<>();
            int skipped = 0;
            for (FeedbackRecord fb : feedback) {
                RecommendationRecord rec = fb.getRecommendationId() == null ? null : byId.get(fb.getRecommendationId());
                if (rec == null) {
                    skipped++;
                    continue;
                }
                try {
                    samples.add(toSample(fb, rec));
                } catch (IllegalArgumentException ex) {
                    log.warn("Skipping feedback row | feedbackId={} | recommendationId={} | reason={}",
                        fb.getId(), fb.getRecommendationId(), ex.getMessage());
                    skipped++;
                }
            }

            if (samples.size() < minSamples) {
                log.info("Training data below minimum | samples={} | required={} | skipped={}",
                    samples.size(), minSamples, skipped);
                return List.of();
            }
            log.info("Training data assembled | samples={} | skipped={}", samples.size(), skipped);
            return samples;
        } catch (DataAccessException ex) {
            log.error("Training data unavailable | reason={}", ex.getMessage());
            return List.of();
        }
    }

    private ReentrantLock lockFor(String key) {
        return keyLocks[Math.floorMod(key.hashCode(), keyLocks.length)];
    }

    private TrainingSample toSample(FeedbackRecord fb, RecommendationRecord rec) {
        CropProfile profile = knowledgeBase.profileOrGeneric(fb.getCropChosen());
        Season season = Season.parse(rec.getSeason()).orElse(profile.season());
        // expected profit from the catalogue, not the realised one, so the target does not leak into the features
        CropAttributes crop = new CropAttributes(
            season, profile.durationDays(), profile.waterRequirement(), profile.profitPerHectare());
        return new TrainingSample(
            featureExtractor.extract(crop, rec.getWeather(), new GeoPoint(rec.getLatitude(), rec.getLongitude()),
                rec.getSoilType()),
            new TrainingSample.Outcome(fb.isSuccess(), fb.getYieldAchieved(), fb.getProfitRealized()));
    }

    private Optional<RecommendationRecord> findRecommendation(String recommendationId) {
        if (recommendationId == null || recommendationId.isBlank()) {
            return Optional.empty();
        }
        return recommendationRepository.findById(recommendationId);
    }

    static PerformanceSnapshot toSnapshot(PerformanceAggregate aggregate) {
        return PerformanceSnapshot.builder()
            .location(aggregate.getLocation())
            .crop(aggregate.getCrop())
            .season(aggregate.getSeason())
            .totalAttempts(aggregate.getAttempts())
            .successfulAttempts(aggregate.getSuccesses())
            .successRate(aggregate.getSuccessRate())
            .avgYield(aggregate.getAvgYield())
            .avgProfit(aggregate.getAvgProfit())
            .dataQuality(aggregate.getAttempts() >= HIGH_QUALITY_ATTEMPTS ? "high" : "low")
            .lastUpdated(aggregate.getLastUpdated())
            .build();
    }

    private static double pooledRate(List<PerformanceAggregate> aggregates) {
        long attempts = aggregates.stream().mapToLong(PerformanceAggregate::getAttempts).sum();
        long successes = aggregates.stream().mapToLong(PerformanceAggregate::getSuccesses).sum();
        return attempts == 0 ? 0.0 : Math.min(1.0, (double) successes / attempts);
    }

    private static String newId(String prefix, Instant at) {
        return prefix + "_" + ID_TIMESTAMP.format(at) + "_"
            + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return fallback;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
