package com.cropadvisory.service;

import com.cropadvisory.dto.TrainingReport;
import com.cropadvisory.ml.ModelTrainer;
import com.cropadvisory.ml.PredictiveModelEnsemble;
import com.cropadvisory.ml.TrainingSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Rebuilds the model set from the outcome history, on a fixed delay and on demand.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRetrainingService {

    private final OutcomeStoreService outcomeStore;
    private final PredictiveModelEnsemble ensemble;
    private final ModelTrainer trainer;

    @Value("${advisory.ml.retrain-enabled:true}")
    private boolean retrainEnabled = true;

    @Scheduled(fixedDelayString = "${advisory.ml.retrain-interval-ms:86400000}",
               initialDelayString = "${advisory.ml.retrain-interval-ms:86400000}")
    void scheduledRetrain() {
        if (!retrainEnabled) {
            return;
        }
        TrainingReport report = retrain();
        log.info("Scheduled retrain finished | trained={} | samples={}", report.isTrained(), report.getSampleCount());
    }

    public TrainingReport retrain() {
        int minSamples = trainer.getMinSamples();
        List<TrainingSample> samples = outcomeStore.getTrainingData(minSamples);
        if (samples.isEmpty()) {
            return TrainingReport.builder()
                .trained(false)
                .sampleCount(0)
                .minimumSamples(minSamples)
                .model(ensemble.status())
                .message("Not enough joined feedback to train; need " + minSamples + "+ samples")
                .build();
        }
        boolean trained = ensemble.train(samples);
        return TrainingReport.builder()
            .trained(trained)
            .sampleCount(samples.size())
            .minimumSamples(minSamples)
            .model(ensemble.status())
            .message(trained ? "Model set retrained" : "Training skipped or failed; previous model set kept")
            .build();
    }
}
