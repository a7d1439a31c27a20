package com.tracelens.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The same operation called again and again in quick succession, typically a client retrying a failing dependency.
 */
@Value
@Builder
public class RetryStormFinding implements AntiPatternFinding {
    List<String> spanIds;
    List<String> spanNames;
    int count;
    // Longest run of calls separated by less than the configured gap
    int sequentialCount;
    double totalDurationMs;
    boolean exponentialBackoff;
    Impact impact;
    String recommendation;
}
