package com.tracelens.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RootCauseCandidate {
    int rank;
    String spanId;
    String spanName;
    double baselineMs;
    double targetMs;
    double diffMs;
    double diffPercent;
    boolean onCriticalPath;
    double selfTimeMs;
    int depth;
    double confidenceScore;
    @JsonProperty("isLikelyRootCause")
    boolean likelyRootCause;
}
