package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StructureSummary {
    private int baselineSpanCount;
    private int targetSpanCount;
    private int addedCount;
    private int removedCount;
    private int baselineMaxDepth;
    private int targetMaxDepth;
    private int depthChange;
}
