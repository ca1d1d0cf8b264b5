package com.cropadvisory.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RangeEstimate {
    double expected;
    double optimistic;
    double pessimistic;
    String unit;
}
