package com.cropadvisory.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TrainingReport {
    boolean trained;
    int sampleCount;
    int minimumSamples;
    ModelStatusResponse model;
    String message;
}
