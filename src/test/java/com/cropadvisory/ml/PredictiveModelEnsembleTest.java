package com.cropadvisory.ml;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PredictiveModelEnsembleTest {

    @TempDir Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2025-11-01T06:00:00Z"), ZoneOffset.UTC);
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private ModelArtifactStore store;
    private PredictiveModelEnsemble ensemble;

    @BeforeEach
    void setUp() {
        store = new ModelArtifactStore(mapper, tempDir.resolve("models/model-set.json").toString());
        ensemble = new PredictiveModelEnsemble(new ModelTrainer(), store, clock);
    }

    @Test
    void untrained_successProbabilityIsDefault() {
        assertThat(ensemble.isTrained()).isFalse();
        assertThat(ensemble.predictSuccess(features(25.0, 2))).isEqualTo(0.75);
    }

    @Test
    void untrained_yieldAndProfitStayWithinJitterBand() {
        FeatureVector fv = features(25.0, 2);
        for (int i = 0; i < 200; i++) {
            assertThat(ensemble.predictYield(fv, 100.0)).isBetween(90.0, 110.0);
            assertThat(ensemble.predictProfit(fv, 50_000.0)).isBetween(42_500.0, 57_500.0);
        }
    }

    @Test
    void untrained_deterministicFallbackReturnsBaseValue() {
        ReflectionTestUtils.setField(ensemble, "deterministicFallback", true);
        FeatureVector fv = features(25.0, 2);

        assertThat(ensemble.predictYield(fv, 45.0)).isEqualTo(45.0);
        assertThat(ensemble.predictProfit(fv, 70_625.0)).isEqualTo(70_625.0);
    }

    @Test
    void train_belowMinimumSamples_keepsEnsembleUntrained() {
        boolean trained = ensemble.train(samples(49, 7));

        assertThat(trained).isFalse();
        assertThat(ensemble.isTrained()).isFalse();
        assertThat(ensemble.predictSuccess(features(25.0, 2))).isEqualTo(0.75);
        assertThat(Files.exists(store.getArtifactPath())).isFalse();
    }

    @Test
    void train_atMinimumSamples_publishesModelSetAndPersistsIt() {
        boolean trained = ensemble.train(samples(50, 7));

        assertThat(trained).isTrue();
        assertThat(ensemble.isTrained()).isTrue();
        assertThat(ensemble.status().getVersion()).isEqualTo(1L);
        assertThat(ensemble.status().getSampleCount()).isEqualTo(50);
        assertThat(ensemble.status().getTrainedAt()).isEqualTo(clock.instant());
        assertThat(Files.exists(store.getArtifactPath())).isTrue();
    }

    @Test
    void trained_predictionsAreRangeSafe() {
        ensemble.train(samples(120, 11));

        for (double temp = -10; temp <= 55; temp += 5) {
            for (int soil = 1; soil <= 6; soil++) {
                FeatureVector fv = features(temp, soil);
                assertThat(ensemble.predictSuccess(fv)).isBetween(0.0, 1.0);
                assertThat(ensemble.predictYield(fv, 40.0)).isGreaterThanOrEqualTo(0.0);
                assertThat(ensemble.predictProfit(fv, 50_000.0)).isGreaterThanOrEqualTo(0.0);
            }
        }
    }

    @Test
    void trained_learnsTheSuccessSignal() {
        ensemble.train(samples(300, 3));

        assertThat(ensemble.predictSuccess(features(24.0, 6)))
            .isGreaterThan(ensemble.predictSuccess(features(42.0, 6)));
    }

    @Test
    void retrain_incrementsVersion() {
        ensemble.train(samples(60, 1));
        ensemble.train(samples(70, 2));

        assertThat(ensemble.status().getVersion()).isEqualTo(2L);
        assertThat(ensemble.status().getSampleCount()).isEqualTo(70);
    }

    @Test
    void saveAndLoad_restoresIdenticalPredictions() {
        ensemble.train(samples(80, 5));
        FeatureVector query = features(29.0, 3);
        double success = ensemble.predictSuccess(query);
        double yield = ensemble.predictYield(query, 40.0);
        double profit = ensemble.predictProfit(query, 50_000.0);

        PredictiveModelEnsemble restored = new PredictiveModelEnsemble(new ModelTrainer(), store, clock);
        assertThat(restored.load()).isTrue();

        assertThat(restored.predictSuccess(query)).isEqualTo(success);
        assertThat(restored.predictYield(query, 40.0)).isEqualTo(yield);
        assertThat(restored.predictProfit(query, 50_000.0)).isEqualTo(profit);
        assertThat(restored.status().getVersion()).isEqualTo(1L);
    }

    @Test
    void load_corruptArtifact_leavesEnsembleUntrained() throws IOException {
        Files.createDirectories(store.getArtifactPath().getParent());
        Files.writeString(store.getArtifactPath(), "{not json");

        assertThat(ensemble.load()).isFalse();
        assertThat(ensemble.isTrained()).isFalse();
    }

    @Test
    void load_jsonNullArtifact_leavesEnsembleUntrained() throws IOException {
        Files.createDirectories(store.getArtifactPath().getParent());
        Files.writeString(store.getArtifactPath(), "null");

        assertThat(store.load()).isEmpty();
        assertThat(ensemble.load()).isFalse();
        assertThat(ensemble.isTrained()).isFalse();
        assertThat(ensemble.predictSuccess(features(25.0, 2))).isEqualTo(0.75);
    }

    @Test
    void load_emptyObjectArtifact_leavesEnsembleUntrained() throws IOException {
        Files.createDirectories(store.getArtifactPath().getParent());
        Files.writeString(store.getArtifactPath(), "{}");

        assertThat(ensemble.load()).isFalse();
        assertThat(ensemble.isTrained()).isFalse();
    }

    @Test
    void load_storeThrowsRuntimeException_leavesEnsembleUntrained() throws IOException {
        ModelArtifactStore brokenStore = mock(ModelArtifactStore.class);
        when(brokenStore.load()).thenThrow(new IllegalStateException("truncated artifact"));
        PredictiveModelEnsemble candidate = new PredictiveModelEnsemble(new ModelTrainer(), brokenStore, clock);

        assertThat(candidate.load()).isFalse();
        assertThat(candidate.isTrained()).isFalse();
    }

    @Test
    void train_artifactWriteFails_stillServesFittedModels() throws IOException {
        ModelArtifactStore failingStore = mock(ModelArtifactStore.class);
        doThrow(new IOException("disk full")).when(failingStore).save(any());
        PredictiveModelEnsemble unsaved = new PredictiveModelEnsemble(new ModelTrainer(), failingStore, clock);

        assertThat(unsaved.train(samples(80, 5))).isTrue();

        assertThat(unsaved.isTrained()).isTrue();
        assertThat(unsaved.status().getVersion()).isEqualTo(1L);
        assertThat(unsaved.predictSuccess(features(24.0, 6))).isBetween(0.0, 1.0);
        assertThat(unsaved.save()).isFalse();
        verify(failingStore, times(2)).save(any());
    }

    @Test
    void save_withoutModel_returnsFalse() {
        assertThat(ensemble.save()).isFalse();
    }

    private static FeatureVector features(double temperature, int soilCode) {
        double[] v = new double[FeatureVector.SIZE];
        v[FeatureVector.TEMP_CURRENT] = temperature;
        v[FeatureVector.TEMP_AVG_7DAY] = temperature;
        v[FeatureVector.TEMP_MIN_7DAY] = temperature - 3;
        v[FeatureVector.TEMP_MAX_7DAY] = temperature + 3;
        v[FeatureVector.HUMIDITY] = 60;
        v[FeatureVector.RAINFALL_CURRENT] = 0;
        v[FeatureVector.RAINFALL_7DAY] = 10;
        v[FeatureVector.SOIL_CODE] = soilCode;
        v[FeatureVector.SEASON_CODE] = 2;
        v[FeatureVector.LATITUDE] = 28.6;
        v[FeatureVector.LONGITUDE] = 77.2;
        v[FeatureVector.DURATION_DAYS] = 120;
        v[FeatureVector.WATER_REQUIREMENT] = 2;
        v[FeatureVector.PROFIT_NORMALIZED] = 0.7;
        return FeatureVector.of(v);
    }

    /** Outcomes succeed near 24°C and fail in heat; yield falls off with distance from 24°C. */
    private static List<TrainingSample> samples(int n, long seed) {
        Random random = new Random(seed);
        List<TrainingSample> samples = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double temp = 12 + random.nextDouble() * 30;
            FeatureVector fv = features(temp, 1 + random.nextInt(6));
            double distance = Math.abs(temp - 24);
            boolean success = distance + random.nextGaussian() * 2 < 8;
            double yield = Math.max(0, 50 - 1.5 * distance + random.nextGaussian() * 2);
            double profit = Math.max(0, 70_000 - 2_000 * distance + random.nextGaussian() * 1_000);
            samples.add(new TrainingSample(fv, new TrainingSample.Outcome(success, yield, profit)));
        }
        return samples;
    }
}
