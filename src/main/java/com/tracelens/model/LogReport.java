package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class LogReport {
    private List<LogPattern> patterns;
    private List<PatternShift> newPatterns;
    private List<PatternShift> increasedPatterns;
    private List<PatternShift> decreasedPatterns;
    private List<PatternShift> disappearedPatterns;
    private int stableCount;
    private PatternSummary baselineSummary;
    private PatternSummary comparisonSummary;
    private AlertLevel alertLevel;
}
