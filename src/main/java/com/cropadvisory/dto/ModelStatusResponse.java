package com.cropadvisory.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelStatusResponse {
    boolean trained;
    Long version;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant trainedAt;
    Integer sampleCount;
    Double trainingAccuracy;
    Double yieldRmse;
    Double profitRmse;
    int featureCount;
}
