package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

/**
 * Frequency change of one template between the baseline and comparison windows.
 * Rates are per-window shares of all records.
 */
@Data
@Builder
public class PatternShift {
    private ShiftType type;
    private LogPattern pattern;
    private String baselineTemplate;
    private int baselineCount;
    private int comparisonCount;
    private double baselineRate;
    private double comparisonRate;
    private double changePct;
}
