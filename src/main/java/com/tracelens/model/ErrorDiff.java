package com.tracelens.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ErrorDiff implements SpanDiff {
    String spanId;
    String spanName;
    String targetSpanId;
    SpanStatus baselineStatus;
    SpanStatus targetStatus;
    ErrorChange change;
    double diffMs;
    double diffPercent;
}
