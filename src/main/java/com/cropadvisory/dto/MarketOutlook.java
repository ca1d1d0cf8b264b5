package com.cropadvisory.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MarketOutlook {
    long currentPrice;
    long nextThreeMonths;
    long nextSixMonths;
    long nextYear;
    String trend;
    String volatility;
    String confidence;
    String dataSource;
}
