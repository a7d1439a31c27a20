package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class PatternSummary {
    private int totalRecords;
    private int patternCount;
    private Map<String, Integer> severityDistribution;
    private List<LogPattern> topPatterns;
    private List<LogPattern> errorPatterns;
}
