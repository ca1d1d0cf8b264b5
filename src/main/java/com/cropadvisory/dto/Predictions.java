package com.cropadvisory.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Predictions {
    double successProbability;
    RangeEstimate yield;
    RangeEstimate profit;
    MarketOutlook marketPrice;
    /** ml-model, historical or untrained-default. */
    String method;
    String dataSource;
}
