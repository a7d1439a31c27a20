package com.tracelens.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A timeout that propagated up through its ancestors. Span ids run from the originating span to the outermost one.
 */
@Value
@Builder
public class CascadingTimeoutFinding implements AntiPatternFinding {
    List<String> spanIds;
    List<String> spanNames;
    int count;
    double totalDurationMs;
    String originSpanName;
    Impact impact;
    String recommendation;
}
