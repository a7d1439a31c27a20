package com.tracelens.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Historical and current samples of one metric. When {@code bucketSeconds} is set and samples carry
 * timestamps, the trend is computed over per-bucket means.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatisticsRequest {
    private String metric;
    private List<MetricSample> historical;
    private List<MetricSample> current;
    private Long bucketSeconds;
}
