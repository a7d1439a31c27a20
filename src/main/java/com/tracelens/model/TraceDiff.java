package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class TraceDiff {
    private MatchStrategy matchStrategy;
    private int matchedCount;
    private List<LatencyDiff> latencyDiffs;
    private List<ErrorDiff> errorDiffs;
    private List<StructureDiff> structureDiffs;
    private StructureSummary structure;
    private double baselineDurationMs;
    private double targetDurationMs;
}
