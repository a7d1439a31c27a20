package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of comparing a baseline trace with a target trace. Sections whose analysis failed are null
 * and the reason is listed in {@code failures}.
 */
@Data
@Builder
public class ComparisonReport {
    private String baselineTraceId;
    private String targetTraceId;
    private double baselineDurationMs;
    private double targetDurationMs;
    private double durationDiffMs;
    private double durationDiffPercent;
    private TraceDiff diff;
    private CriticalPathReport baselineCriticalPath;
    private CriticalPathReport targetCriticalPath;
    private List<AntiPatternFinding> antiPatterns;
    private List<RootCauseCandidate> rootCauseCandidates;
    private DataQualityReport baselineQuality;
    private DataQualityReport targetQuality;
    @Builder.Default
    private List<AnalysisFailure> failures = new ArrayList<>();
}
