package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CriticalPathNode {
    private String spanId;
    private String name;
    private double durationMs;
    private double selfTimeMs;
    private int depth;
    // Share of the whole trace duration spent in this span's own work
    private double contributionPct;
    // Share of the critical path spent in this span's own work
    private double blockingContributionPct;
}
