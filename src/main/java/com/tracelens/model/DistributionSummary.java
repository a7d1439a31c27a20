package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DistributionSummary {
    private int count;
    private double mean;
    private double stdDev;
    private double min;
    private double max;
    private double p50;
    private double p90;
    private double p95;
    private double p99;
}
