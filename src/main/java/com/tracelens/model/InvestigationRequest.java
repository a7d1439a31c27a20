package com.tracelens.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Any combination of traces, metric samples and log windows to analyze together. Missing parts are skipped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvestigationRequest {
    private TraceComparisonRequest traces;
    private StatisticsRequest statistics;
    private LogAnalysisRequest logs;
}
