package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SpanLatencyAnomaly {
    private String spanId;
    private String spanName;
    private double durationMs;
    private double baselineMeanMs;
    private double baselineStdDevMs;
    private double zScore;
    private Impact severity;
}
