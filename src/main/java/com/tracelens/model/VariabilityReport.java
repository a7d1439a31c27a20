package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class VariabilityReport {
    private int traceCount;
    private DistributionSummary durationSummary;
    private TrendResult durationTrend;
    private List<SpanVariabilityPattern> patterns;
    private List<String> notes;
}
