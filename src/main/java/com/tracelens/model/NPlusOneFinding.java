package com.tracelens.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Repeated sibling calls with the same name under one parent.
 */
@Value
@Builder
public class NPlusOneFinding implements AntiPatternFinding {
    String parentSpanId;
    List<String> spanNames;
    int count;
    double totalDurationMs;
    double avgDurationMs;
    Impact impact;
    String recommendation;
}
