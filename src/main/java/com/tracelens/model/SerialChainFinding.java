package com.tracelens.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Back-to-back spans that could likely run in parallel.
 */
@Value
@Builder
public class SerialChainFinding implements AntiPatternFinding {
    List<String> spanIds;
    List<String> spanNames;
    int count;
    double totalDurationMs;
    // Time saved if the chain ran fully in parallel
    double potentialSavingsMs;
    Impact impact;
    String recommendation;
}
