package com.tracelens.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LatencyDiff implements SpanDiff {
    String spanId;
    String spanName;
    // Span id of the matched span in the target trace, equal to spanId when matched by id
    String targetSpanId;
    double baselineMs;
    double targetMs;
    double diffMs;
    double diffPercent;

    public boolean isRegression() {
        return diffMs > 0;
    }
}
