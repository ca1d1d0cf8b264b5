package com.cropadvisory.ml;

import com.cropadvisory.dto.ModelStatusResponse;
import com.cropadvisory.exception.TrainingInsufficientDataException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Success / yield / profit predictor backed by a single atomically published
 * {@link ModelSet}.
 *
 * <p>Untrained contract: {@link #predictSuccess} returns {@value #UNTRAINED_SUCCESS_PROBABILITY};
 * yield and profit return the caller's base value with a bounded multiplicative
 * jitter (±{@code advisory.ml.untrained-yield-jitter}, ±{@code advisory.ml.untrained-profit-jitter}),
 * or the base value unchanged when {@code advisory.ml.deterministic-fallback} is set.
 *
 * <p>Training never blocks prediction: readers keep using the published set until
 * the replacement is fully fitted and persisted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictiveModelEnsemble {

    public static final double UNTRAINED_SUCCESS_PROBABILITY = 0.75;

    private final ModelTrainer trainer;
    private final ModelArtifactStore artifactStore;
    private final Clock clock;

    @Value("${advisory.ml.untrained-yield-jitter:0.10}")
    private double yieldJitter = 0.10;

    @Value("${advisory.ml.untrained-profit-jitter:0.15}")
    private double profitJitter = 0.15;

    @Value("${advisory.ml.deterministic-fallback:false}")
    private boolean deterministicFallback;

    private final AtomicReference<ModelSet> current = new AtomicReference<>();
    private final ReentrantLock trainingLock = new ReentrantLock();

    @PostConstruct
    void init() {
        load();
    }

    public boolean isTrained() {
        return current.get() != null;
    }

    public Optional<ModelSet> currentModelSet() {
        return Optional.ofNullable(current.get());
    }

    public double predictSuccess(FeatureVector features) {
        ModelSet models = current.get();
        if (models == null) {
            return UNTRAINED_SUCCESS_PROBABILITY;
        }
        double probability = models.successModel().probability(models.scaler().transform(features.toArray()));
        if (!Double.isFinite(probability)) {
            log.warn("Non-finite success probability, using default | version={}", models.version());
            return UNTRAINED_SUCCESS_PROBABILITY;
        }
        return clamp(probability, 0.0, 1.0);
    }

    public double predictYield(FeatureVector features, double baseValue) {
        ModelSet models = current.get();
        if (models == null) {
            return jittered(baseValue, yieldJitter);
        }
        return regress(models.yieldModel(), models, features, baseValue);
    }

    public double predictProfit(FeatureVector features, double baseValue) {
        ModelSet models = current.get();
        if (models == null) {
            return jittered(baseValue, profitJitter);
        }
        return regress(models.profitModel(), models, features, baseValue);
    }

    /**
     * Fits a new model set and swaps it in. Returns false, leaving the published set
     * untouched, when data is insufficient, fitting fails, or another training run
     * is already in progress.
     */
    public boolean train(List<TrainingSample> samples) {
        if (!trainingLock.tryLock()) {
            log.warn("Training already in progress, skipping request | samples={}", samples == null ? 0 : samples.size());
            return false;
        }
        try {
            ModelSet previous = current.get();
            long nextVersion = previous == null ? 1L : previous.version() + 1;
            ModelSet fitted = trainer.fit(samples, nextVersion, Instant.now(clock));
            persist(fitted);
            current.set(fitted);
            log.info("Model set trained | version={} | samples={} | accuracy={} | yieldRmse={} | profitRmse={}",
                fitted.version(), fitted.sampleCount(), fitted.metrics().accuracy(),
                fitted.metrics().yieldRmse(), fitted.metrics().profitRmse());
            return true;
        } catch (TrainingInsufficientDataException ex) {
            log.warn("{}", ex.getMessage());
            return false;
        } catch (IllegalArgumentException ex) {
            log.error("Model training failed, keeping current model set | reason={}", ex.getMessage(), ex);
            return false;
        } finally {
            trainingLock.unlock();
        }
    }

    /**
     * Loads the persisted artifact. Any failure leaves the ensemble untrained.
     */
    public boolean load() {
        try {
            Optional<ModelSet> loaded = artifactStore.load();
            if (loaded.isEmpty()) {
                log.info("No persisted model set found, running untrained | path={}", artifactStore.getArtifactPath());
                return false;
            }
            ModelSet modelSet = loaded.get();
            if (!modelSet.isCompatible()) {
                log.warn("Persisted model set does not match the feature layout, ignoring | version={}", modelSet.version());
                return false;
            }
            current.set(modelSet);
            log.info("Model set loaded | version={} | samples={}", modelSet.version(), modelSet.sampleCount());
            return true;
        } catch (IOException | RuntimeException ex) {
            log.warn("Model set could not be loaded, running untrained | path={} | reason={}",
                artifactStore.getArtifactPath(), ex.getMessage());
            return false;
        }
    }

    /**
     * Persists the current model set, if any. Returns false on I/O failure.
     */
    public boolean save() {
        ModelSet models = current.get();
        if (models == null) {
            return false;
        }
        return persist(models);
    }

    public ModelStatusResponse status() {
        ModelSet models = current.get();
        if (models == null) {
            return ModelStatusResponse.builder().trained(false).featureCount(FeatureVector.SIZE).build();
        }
        return ModelStatusResponse.builder()
            .trained(true)
            .version(models.version())
            .trainedAt(models.trainedAt())
            .sampleCount(models.sampleCount())
            .trainingAccuracy(models.metrics().accuracy())
            .yieldRmse(models.metrics().yieldRmse())
            .profitRmse(models.metrics().profitRmse())
            .featureCount(FeatureVector.SIZE)
            .build();
    }

    private boolean persist(ModelSet models) {
        try {
            artifactStore.save(models);
            return true;
        } catch (IOException ex) {
            // the in-memory set stays usable; the next training run rewrites the artifact
            log.error("Model artifact write failed, serving unsaved model set | version={} | reason={}",
                models.version(), ex.getMessage());
            return false;
        }
    }

    private double regress(RidgeRegressor model, ModelSet models, FeatureVector features, double baseValue) {
        double predicted = model.predict(models.scaler().transform(features.toArray()));
        if (!Double.isFinite(predicted)) {
            log.warn("Non-finite regression output, using base value | version={}", models.version());
            return Math.max(0.0, baseValue);
        }
        return Math.max(0.0, predicted);
    }

    private double jittered(double baseValue, double jitter) {
        double base = Math.max(0.0, baseValue);
        if (deterministicFallback || jitter <= 0.0) {
            return base;
        }
        return base * ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
