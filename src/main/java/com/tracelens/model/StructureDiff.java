package com.tracelens.model;

import lombok.Builder;
import lombok.Value;

/**
 * A span present in only one of the two traces. Added spans carry a positive duration delta,
 * removed spans a negative one.
 */
@Value
@Builder
public class StructureDiff implements SpanDiff {
    String spanId;
    String spanName;
    StructureChange change;
    int depth;
    double diffMs;
    double diffPercent;
}
