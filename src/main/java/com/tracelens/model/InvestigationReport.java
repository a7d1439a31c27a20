package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class InvestigationReport {
    private ComparisonReport comparison;
    private StatisticsReport statistics;
    private LogReport logs;
    @Builder.Default
    private List<AnalysisFailure> failures = new ArrayList<>();
}
