package com.tracelens.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Statistics of one metric. A sub-analysis without enough data leaves its section null and adds a note.
 */
@Data
@Builder
public class StatisticsReport {
    private String metric;
    private DistributionSummary summary;
    private ZScoreResult zScore;
    private TrendResult trend;
    private List<Outlier> outliers;
    @Builder.Default
    private List<String> notes = new ArrayList<>();
}
