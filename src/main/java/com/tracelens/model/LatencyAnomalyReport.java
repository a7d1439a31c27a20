package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A target trace checked against a set of baseline traces, as a whole and span by span.
 */
@Data
@Builder
public class LatencyAnomalyReport {
    private String targetTraceId;
    private double targetDurationMs;
    private ZScoreResult traceZScore;
    private List<SpanLatencyAnomaly> anomalousSpans;
}
