package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TrendResult {
    private Trend trend;
    private double firstHalfMean;
    private double secondHalfMean;
    private double pctChange;
    private int points;
}
