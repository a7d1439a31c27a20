package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SpanVariabilityPattern {
    private String spanName;
    private SpanPatternType type;
    private int occurrences;
    private double meanMs;
    private double stdDevMs;
    private double coefficientOfVariation;
    private String description;
}
